package com.example.marketplace.chat.persistence;

import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.service.MessageStore;
import com.example.marketplace.chat.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaMessageStore implements MessageStore {

    private static final Sort NEWEST_FIRST =
            Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final MessageJpaRepository messageJpaRepository;
    private final MessageEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public Message create(String senderId, String receiverId, String text, String listingId) {
        if (!StringUtils.hasText(senderId) || !StringUtils.hasText(receiverId)) {
            throw ServiceException.badRequest(ServiceException.MISSING_PARTICIPANT, "Sender and receiver are required");
        }
        String trimmed = text != null ? text.trim() : "";
        if (trimmed.isEmpty()) {
            throw ServiceException.badRequest(ServiceException.INVALID_MESSAGE, "Message text is required");
        }
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw ServiceException.badRequest(
                    ServiceException.INVALID_MESSAGE, "Message cannot exceed %d characters".formatted(MAX_TEXT_LENGTH));
        }

        Instant now = now();
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .senderId(senderId)
                .receiverId(receiverId)
                .text(trimmed)
                .listingId(StringUtils.hasText(listingId) ? listingId : null)
                .read(false)
                .delivered(false)
                .createdAt(now)
                .updatedAt(now)
                .build();

        messageJpaRepository.save(mapper.toEntity(message));
        return message;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findById(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Optional.empty();
        }
        return messageJpaRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional
    public Optional<Message> markDelivered(String messageId, Instant deliveredAt) {
        Optional<MessageEntity> existing = messageJpaRepository.findById(messageId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Instant createdAt = existing.get().getCreatedAt();
        Instant effective = deliveredAt.isBefore(createdAt) ? createdAt : deliveredAt.truncatedTo(ChronoUnit.MICROS);
        messageJpaRepository.markDelivered(messageId, effective);
        return messageJpaRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional
    public int markRead(String senderId, String receiverId) {
        if (!StringUtils.hasText(senderId) || !StringUtils.hasText(receiverId)) {
            return 0;
        }
        return messageJpaRepository.markRead(senderId, receiverId, now());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findConversationPage(String userId, String counterpartId, int page, int limit) {
        if (page < 1 || limit < 1) {
            return Collections.emptyList();
        }
        return messageJpaRepository
                .findConversation(userId, counterpartId, PageRequest.of(page - 1, limit, NEWEST_FIRST))
                .stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countConversation(String userId, String counterpartId) {
        return messageJpaRepository
                .findConversation(userId, counterpartId, PageRequest.of(0, 1))
                .getTotalElements();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findAllInvolving(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Collections.emptyList();
        }
        return messageJpaRepository.findAllInvolving(userId).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countUnread(String receiverId) {
        if (!StringUtils.hasText(receiverId)) {
            return 0;
        }
        return messageJpaRepository.countUnread(receiverId);
    }

    // database timestamp columns keep microseconds
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
