package com.example.marketplace.chat.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lifecycle notification for downstream consumers (notifications, analytics). For
 * {@link MessageEventType#MESSAGES_READ} there is no single message and {@code messageId} is null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEvent implements Serializable {

    private String eventId;
    private MessageEventType type;
    private String messageId;
    private String senderId;
    private String receiverId;
    private Instant occurredAt;
    private Map<String, Object> payload;

    /** Partition key shared by both directions of a conversation. */
    public static String conversationKey(String userId, String counterpartId) {
        return userId.compareTo(counterpartId) <= 0
                ? userId + ":" + counterpartId
                : counterpartId + ":" + userId;
    }
}
