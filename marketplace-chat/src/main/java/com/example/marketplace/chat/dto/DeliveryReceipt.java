package com.example.marketplace.chat.dto;

import java.time.Instant;
import lombok.Value;

@Value
public class DeliveryReceipt {
    String messageId;
    Instant deliveredAt;
}
