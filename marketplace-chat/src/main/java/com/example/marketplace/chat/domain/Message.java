package com.example.marketplace.chat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A direct message between two marketplace users, optionally about a listing.
 *
 * <p>Only {@code read} and the delivery fields ever change after creation; {@code read} never
 * reverts and {@code deliveredAt} is present exactly when {@code delivered} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {

    /** Newest first, ties broken by identifier. */
    public static final Comparator<Message> NEWEST_FIRST =
            Comparator.comparing(Message::getCreatedAt).thenComparing(Message::getId).reversed();

    private String id;
    private String senderId;
    private String receiverId;
    private String text;
    private String listingId;
    private boolean read;
    private boolean delivered;
    private Instant deliveredAt;
    private Instant createdAt;
    private Instant updatedAt;

    public String counterpartOf(String userId) {
        return userId != null && userId.equals(senderId) ? receiverId : senderId;
    }
}
