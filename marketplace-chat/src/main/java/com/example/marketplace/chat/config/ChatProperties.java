package com.example.marketplace.chat.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @NestedConfigurationProperty
    private final Jwt jwt = new Jwt();

    @NestedConfigurationProperty
    private final Cors cors = new Cors();

    @NestedConfigurationProperty
    private final History history = new History();

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    public Jwt getJwt() {
        return jwt;
    }

    public Cors getCors() {
        return cors;
    }

    public History getHistory() {
        return history;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    @Validated
    public static class Jwt {

        /**
         * Shared HMAC secret used to sign and verify access tokens. Must be at least 32 bytes.
         */
        private String secret = "change-me-in-production-this-is-a-development-secret";

        /**
         * Lifetime of tokens issued by this service.
         */
        private Duration expiresIn = Duration.ofDays(7);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getExpiresIn() {
            return expiresIn;
        }

        public void setExpiresIn(Duration expiresIn) {
            this.expiresIn = expiresIn;
        }
    }

    @Validated
    public static class Cors {

        /**
         * Browser origins allowed to call the REST API and open socket connections.
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }

    @Validated
    public static class History {

        /**
         * Page size used when a history request does not specify one.
         */
        private int defaultPageSize = 50;

        /**
         * Upper bound applied to the requested page size.
         */
        private int maxPageSize = 100;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the chat module.
         */
        private String keyPrefix = "chat";

        /**
         * How long a user's last-seen timestamp is retained after their final connection closes.
         */
        private Duration lastSeenTtl = Duration.ofDays(30);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getLastSeenTtl() {
            return lastSeenTtl;
        }

        public void setLastSeenTtl(Duration lastSeenTtl) {
            this.lastSeenTtl = lastSeenTtl;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Toggle for publishing message lifecycle events.
         */
        private boolean enabled = true;

        /**
         * Kafka topic to publish message lifecycle events.
         */
        private String messageTopic = "marketplace.chat.messages";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMessageTopic() {
            return messageTopic;
        }

        public void setMessageTopic(String messageTopic) {
            this.messageTopic = messageTopic;
        }
    }
}
