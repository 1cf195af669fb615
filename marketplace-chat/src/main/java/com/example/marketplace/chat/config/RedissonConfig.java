package com.example.marketplace.chat.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client for last-seen bookkeeping, built from the standard {@code spring.data.redis.*}
 * settings.
 */
@Configuration
public class RedissonConfig {

    private static final String DEFAULT_CLIENT_NAME = "marketplace-chat";

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        // last-seen values are ISO-8601 strings
        config.setCodec(StringCodec.INSTANCE);

        SingleServerConfig server = config.useSingleServer()
                .setAddress(address(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(StringUtils.hasText(redisProperties.getClientName())
                        ? redisProperties.getClientName()
                        : DEFAULT_CLIENT_NAME)
                .setConnectionMinimumIdleSize(1)
                .setConnectionPoolSize(8);
        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        if (redisProperties.getConnectTimeout() != null) {
            server.setConnectTimeout((int) redisProperties.getConnectTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    private String address(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
