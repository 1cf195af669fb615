package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.Message;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of chat messages. Each call is atomic on its own; no call spans several rows
 * except the set-based {@link #markRead}.
 */
public interface MessageStore {

    int MAX_TEXT_LENGTH = 1000;

    /**
     * Persists a new unread, undelivered message.
     *
     * @throws com.example.marketplace.chat.service.exception.ServiceException when the message is
     *     missing a party or its text is blank or longer than {@link #MAX_TEXT_LENGTH}
     */
    Message create(String senderId, String receiverId, String text, String listingId);

    Optional<Message> findById(String messageId);

    /**
     * Flags the message delivered at {@code deliveredAt}. A message is only ever delivered once;
     * calling this again leaves the first delivery time in place.
     */
    Optional<Message> markDelivered(String messageId, Instant deliveredAt);

    /**
     * Marks every unread message from {@code senderId} to {@code receiverId} as read.
     *
     * @return number of messages that changed state
     */
    int markRead(String senderId, String receiverId);

    /** Page {@code page} (1-based) of the conversation between two users, newest first. */
    List<Message> findConversationPage(String userId, String counterpartId, int page, int limit);

    long countConversation(String userId, String counterpartId);

    /** Every message the user sent or received, newest first. */
    List<Message> findAllInvolving(String userId);

    long countUnread(String receiverId);
}
