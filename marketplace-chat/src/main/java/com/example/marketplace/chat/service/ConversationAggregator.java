package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.ConversationSummary;
import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.service.exception.ServiceException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Inbox view: one row per counterpart, holding the latest message exchanged with them, newest
 * conversation first.
 */
@Service
@RequiredArgsConstructor
public class ConversationAggregator {

    private final MessageStore messageStore;
    private final MessageReadModel readModel;

    @Transactional(readOnly = true)
    public List<ConversationSummary> listConversations(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ServiceException.badRequest(ServiceException.MISSING_PARTICIPANT, "User id is required");
        }

        Map<String, Message> latestByCounterpart = new LinkedHashMap<>();
        messageStore.findAllInvolving(userId).stream()
                .sorted(Message.NEWEST_FIRST)
                .forEach(message -> latestByCounterpart.putIfAbsent(message.counterpartOf(userId), message));

        List<String> counterparts = new ArrayList<>(latestByCounterpart.keySet());
        List<EnrichedMessage> lastMessages = readModel.enrichAll(new ArrayList<>(latestByCounterpart.values()));

        List<ConversationSummary> conversations = new ArrayList<>(counterparts.size());
        for (int i = 0; i < counterparts.size(); i++) {
            conversations.add(ConversationSummary.builder()
                    .counterpartId(counterparts.get(i))
                    .lastMessage(lastMessages.get(i))
                    .build());
        }
        return conversations;
    }
}
