package com.example.marketplace.chat.domain;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One page of a conversation, oldest message first, with the totals needed to render pagination.
 */
@Value
@Builder
public class MessagePage {

    List<EnrichedMessage> messages;
    int page;
    int limit;
    long total;
    int pages;
}
