package com.example.marketplace.chat.service;

import com.example.marketplace.chat.config.ChatProperties;
import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.domain.MessagePage;
import com.example.marketplace.chat.service.exception.ServiceException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Request/response side of messaging: paged history, unread counts and plain sends that do not go
 * through a socket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageHistoryService {

    private final MessageStore messageStore;
    private final MessageReadModel readModel;
    private final ChatProperties chatProperties;

    /**
     * Pages walk backwards from the newest message; inside a page messages are oldest first.
     * Opening any page marks the whole conversation read for {@code userId}, not only the
     * messages on that page.
     */
    @Transactional
    public MessagePage getMessages(String userId, String counterpartId, Integer page, Integer limit) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(counterpartId)) {
            throw ServiceException.badRequest(ServiceException.MISSING_PARTICIPANT, "Both conversation parties are required");
        }
        int pageNumber = page != null ? page : 1;
        int pageSize = limit != null ? limit : chatProperties.getHistory().getDefaultPageSize();
        if (pageNumber < 1) {
            throw ServiceException.badRequest(ServiceException.INVALID_PAGINATION, "Page must be 1 or greater");
        }
        if (pageSize < 1) {
            throw ServiceException.badRequest(ServiceException.INVALID_PAGINATION, "Limit must be 1 or greater");
        }
        pageSize = Math.min(pageSize, chatProperties.getHistory().getMaxPageSize());

        int marked = messageStore.markRead(counterpartId, userId);
        if (marked > 0) {
            log.debug("Marked {} messages from {} read for {}", marked, counterpartId, userId);
        }

        List<Message> chronological = new ArrayList<>(
                messageStore.findConversationPage(userId, counterpartId, pageNumber, pageSize));
        Collections.reverse(chronological);
        List<EnrichedMessage> messages = readModel.enrichAll(chronological);

        long total = messageStore.countConversation(userId, counterpartId);
        int pages = (int) ((total + pageSize - 1) / pageSize);
        return MessagePage.builder()
                .messages(messages)
                .page(pageNumber)
                .limit(pageSize)
                .total(total)
                .pages(pages)
                .build();
    }

    @Transactional(readOnly = true)
    public long unreadCount(String userId) {
        return messageStore.countUnread(userId);
    }

    /**
     * Stores a message sent over HTTP. Unlike a socket send this does not look at the receiver's
     * presence or push anything to live connections.
     */
    @Transactional
    public EnrichedMessage send(String senderId, String receiverId, String text, String listingId) {
        Message message = messageStore.create(senderId, receiverId, text, listingId);
        return readModel.enrich(message);
    }
}
