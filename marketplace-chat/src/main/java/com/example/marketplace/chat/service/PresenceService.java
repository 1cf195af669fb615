package com.example.marketplace.chat.service;

import com.example.marketplace.chat.config.ChatProperties;
import com.example.marketplace.chat.domain.PresenceSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Service;

/**
 * Online state comes from the live {@link PresenceRegistry}; the last-seen instant of offline users
 * is kept in Redis so it survives restarts.
 */
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final PresenceRegistry presenceRegistry;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public void markSeen(String userId) {
        RBucket<String> bucket = bucket(userId);
        bucket.set(clock.instant().toString());
        Duration ttl = chatProperties.getRedis().getLastSeenTtl();
        if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
            bucket.expire(ttl);
        }
    }

    public Optional<Instant> lastSeen(String userId) {
        String result = bucket(userId).get();
        if (result == null) {
            return Optional.empty();
        }
        return Optional.of(Instant.parse(result));
    }

    public PresenceSnapshot snapshot(String userId) {
        int connections = presenceRegistry.occupancy(userId);
        return PresenceSnapshot.builder()
                .userId(userId)
                .online(connections > 0)
                .connections(connections)
                .lastSeen(connections > 0 ? null : lastSeen(userId).orElse(null))
                .build();
    }

    private RBucket<String> bucket(String userId) {
        return redissonClient.getBucket(keyFactory.lastSeenKey(userId), StringCodec.INSTANCE);
    }
}
