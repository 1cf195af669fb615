package com.example.marketplace.chat.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PresenceSnapshot {

    String userId;
    boolean online;
    int connections;
    Instant lastSeen;
}
