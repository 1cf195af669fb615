package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.domain.UserSummary;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the wire shape of messages. Looking up display fields is best effort: when the account
 * lookup fails the messages still go out, carrying only the party ids.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageReadModel {

    private final UserDirectory userDirectory;

    public EnrichedMessage enrich(Message message) {
        return enrichAll(List.of(message)).get(0);
    }

    public List<EnrichedMessage> enrichAll(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, UserSummary> users = loadUsers(messages);
        return messages.stream()
                .map(message -> project(message, users))
                .toList();
    }

    private Map<String, UserSummary> loadUsers(List<Message> messages) {
        Set<String> userIds = new HashSet<>();
        for (Message message : messages) {
            userIds.add(message.getSenderId());
            userIds.add(message.getReceiverId());
        }
        try {
            return userDirectory.summaries(userIds);
        } catch (RuntimeException ex) {
            log.warn("Could not load display fields for {} users; sending messages unenriched", userIds.size(), ex);
            return Map.of();
        }
    }

    static EnrichedMessage project(Message message, Map<String, UserSummary> users) {
        return EnrichedMessage.builder()
                .id(message.getId())
                .senderId(message.getSenderId())
                .receiverId(message.getReceiverId())
                .sender(users.getOrDefault(message.getSenderId(), UserSummary.unresolved(message.getSenderId())))
                .receiver(users.getOrDefault(message.getReceiverId(), UserSummary.unresolved(message.getReceiverId())))
                .text(message.getText())
                .listingId(message.getListingId())
                .read(message.isRead())
                .delivered(message.isDelivered())
                .deliveredAt(message.getDeliveredAt())
                .createdAt(message.getCreatedAt())
                .updatedAt(message.getUpdatedAt())
                .build();
    }
}
