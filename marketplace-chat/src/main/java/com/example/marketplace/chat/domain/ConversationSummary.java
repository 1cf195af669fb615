package com.example.marketplace.chat.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversationSummary {

    String counterpartId;
    EnrichedMessage lastMessage;
}
