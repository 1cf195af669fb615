package com.example.marketplace.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire projection of a {@link Message} joined with the display fields of both parties.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedMessage implements Serializable {

    private String id;
    private String senderId;
    private String receiverId;
    private UserSummary sender;
    private UserSummary receiver;
    private String text;
    private String listingId;

    @JsonProperty("isRead")
    private boolean read;

    @JsonProperty("isDelivered")
    private boolean delivered;

    private Instant deliveredAt;
    private Instant createdAt;
    private Instant updatedAt;
}
