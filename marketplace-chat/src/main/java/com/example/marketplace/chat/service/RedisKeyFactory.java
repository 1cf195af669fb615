package com.example.marketplace.chat.service;

import com.example.marketplace.chat.config.ChatProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final ChatProperties chatProperties;

    public RedisKeyFactory(ChatProperties chatProperties) {
        this.chatProperties = chatProperties;
    }

    private String prefix() {
        return chatProperties.getRedis().getKeyPrefix();
    }

    public String lastSeenKey(String userId) {
        return "%s:presence:%s:last-seen".formatted(prefix(), userId);
    }
}
