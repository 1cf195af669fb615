package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.dto.DeliveryReceipt;
import com.example.marketplace.chat.dto.ErrorPayload;
import com.example.marketplace.chat.dto.ReadReceipt;
import com.example.marketplace.chat.dto.SendMessagePayload;
import com.example.marketplace.chat.dto.TypingNotice;
import com.example.marketplace.chat.event.ChatEvents;
import com.example.marketplace.chat.event.MessageEvent;
import com.example.marketplace.chat.event.MessageEventPublisher;
import com.example.marketplace.chat.event.MessageEventType;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Handles the socket-side chat operations of an authenticated connection.
 *
 * <p>Delivery is decided once, while handling the send: the message is flagged delivered when the
 * receiver has a live connection at that moment and stays undelivered otherwise. Nothing is queued
 * or retried for offline receivers; they pick the message up through the history endpoint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDispatcher {

    static final String SEND_FAILED = "Failed to send message";
    static final String NOT_AUTHENTICATED = "Not authenticated";

    private final MessageStore messageStore;
    private final MessageReadModel readModel;
    private final PresenceRegistry presenceRegistry;
    private final MessageEventPublisher eventPublisher;
    private final Clock clock;

    public DispatchResult handleSend(ChatConnection origin, String senderId, SendMessagePayload payload) {
        if (!StringUtils.hasText(senderId)) {
            log.warn("Rejected send on unauthenticated connection {}", origin.getId());
            origin.send(ChatEvents.MESSAGE_ERROR, new ErrorPayload(NOT_AUTHENTICATED));
            return DispatchResult.rejected();
        }

        String receiverId = payload != null ? payload.getReceiverId() : null;
        Message message;
        try {
            message = messageStore.create(
                    senderId,
                    receiverId,
                    payload != null ? payload.getText() : null,
                    payload != null ? payload.getListingId() : null);
        } catch (RuntimeException ex) {
            log.error("Failed to persist message from {} to {}", senderId, receiverId, ex);
            origin.send(ChatEvents.MESSAGE_ERROR, new ErrorPayload(SEND_FAILED));
            return DispatchResult.failed();
        }
        publish(MessageEventType.MESSAGE_SENT, message, message.getCreatedAt());

        if (presenceRegistry.occupancy(receiverId) > 0) {
            Optional<Message> delivered = markDelivered(message);
            if (delivered.isPresent()) {
                return deliverImmediately(origin, delivered.get());
            }
        }

        EnrichedMessage enriched = readModel.enrich(message);
        presenceRegistry.broadcast(receiverId, ChatEvents.RECEIVE_MESSAGE, enriched);
        origin.send(ChatEvents.MESSAGE_SENT, enriched);
        log.debug("Message {} from {} left undelivered; {} is offline", message.getId(), senderId, receiverId);
        return new DispatchResult(DispatchResult.Outcome.QUEUED_UNDELIVERED, enriched);
    }

    public void typing(String userId, String receiverId) {
        if (StringUtils.hasText(userId) && StringUtils.hasText(receiverId)) {
            presenceRegistry.broadcast(receiverId, ChatEvents.USER_TYPING, new TypingNotice(userId));
        }
    }

    public void stopTyping(String userId, String receiverId) {
        if (StringUtils.hasText(userId) && StringUtils.hasText(receiverId)) {
            presenceRegistry.broadcast(receiverId, ChatEvents.USER_STOP_TYPING, new TypingNotice(userId));
        }
    }

    /**
     * Marks everything {@code originalSenderId} sent to {@code readerId} as read and tells the
     * original sender. Failures are logged only; the reader gets no error event.
     *
     * @return number of messages that became read
     */
    public int markRead(String readerId, String originalSenderId) {
        if (!StringUtils.hasText(readerId) || !StringUtils.hasText(originalSenderId)) {
            return 0;
        }
        try {
            int updated = messageStore.markRead(originalSenderId, readerId);
            presenceRegistry.broadcast(originalSenderId, ChatEvents.MESSAGES_READ, new ReadReceipt(readerId));
            if (updated > 0) {
                eventPublisher.publish(MessageEvent.builder()
                        .eventId(UUID.randomUUID().toString())
                        .type(MessageEventType.MESSAGES_READ)
                        .senderId(originalSenderId)
                        .receiverId(readerId)
                        .occurredAt(clock.instant())
                        .payload(Map.of("count", updated))
                        .build());
            }
            return updated;
        } catch (RuntimeException ex) {
            log.error("Failed to mark messages from {} read for {}", originalSenderId, readerId, ex);
            return 0;
        }
    }

    private DispatchResult deliverImmediately(ChatConnection origin, Message delivered) {
        EnrichedMessage enriched = readModel.enrich(delivered);
        presenceRegistry.broadcast(delivered.getReceiverId(), ChatEvents.RECEIVE_MESSAGE, enriched);
        presenceRegistry.broadcast(
                delivered.getSenderId(),
                ChatEvents.MESSAGE_DELIVERED,
                new DeliveryReceipt(delivered.getId(), delivered.getDeliveredAt()));
        origin.send(ChatEvents.MESSAGE_SENT, enriched);
        publish(MessageEventType.MESSAGE_DELIVERED, delivered, delivered.getDeliveredAt());
        log.debug("Message {} delivered to {}", delivered.getId(), delivered.getReceiverId());
        return new DispatchResult(DispatchResult.Outcome.DELIVERED_IMMEDIATE, enriched);
    }

    // A failed delivery update falls back to the undelivered path rather than failing the send.
    private Optional<Message> markDelivered(Message message) {
        try {
            return messageStore.markDelivered(message.getId(), clock.instant())
                    .filter(Message::isDelivered);
        } catch (RuntimeException ex) {
            log.warn("Could not flag message {} delivered", message.getId(), ex);
            return Optional.empty();
        }
    }

    private void publish(MessageEventType type, Message message, Instant occurredAt) {
        eventPublisher.publish(MessageEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .messageId(message.getId())
                .senderId(message.getSenderId())
                .receiverId(message.getReceiverId())
                .occurredAt(occurredAt)
                .payload(message.getListingId() != null ? Map.of("listingId", message.getListingId()) : Map.of())
                .build());
    }
}
