package com.example.marketplace.chat.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_messages",
        indexes = {
            @Index(name = "idx_chat_messages_pair", columnList = "sender_id, receiver_id"),
            @Index(name = "idx_chat_messages_created_at", columnList = "created_at")
        })
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "sender_id", nullable = false, updatable = false, length = 64)
    private String senderId;

    @Column(name = "receiver_id", nullable = false, updatable = false, length = 64)
    private String receiverId;

    @Column(name = "text", nullable = false, updatable = false, length = 1000)
    private String text;

    @Column(name = "listing_id", updatable = false, length = 64)
    private String listingId;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "is_delivered", nullable = false)
    private boolean delivered;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
