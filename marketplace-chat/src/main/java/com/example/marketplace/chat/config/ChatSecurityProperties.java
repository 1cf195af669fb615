package com.example.marketplace.chat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat.security")
public class ChatSecurityProperties {

    /**
     * Toggle to enable or disable the per-address limiter in front of the REST API.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Whether the first {@code X-Forwarded-For} entry identifies the client. Only enable behind a
     * proxy that overwrites the header.
     */
    private boolean trustForwardedFor = true;

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public boolean isTrustForwardedFor() {
        return trustForwardedFor;
    }

    public void setTrustForwardedFor(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    /**
     * Token bucket applied to each client address: {@code capacity} requests at most, topped up by
     * {@code refillTokens} once every {@code refillPeriod}.
     */
    public static class RateLimit {

        @Min(1)
        private long capacity = 100;

        @Min(1)
        private long refillTokens = 100;

        @NotNull
        private Duration refillPeriod = Duration.ofMinutes(15);

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
