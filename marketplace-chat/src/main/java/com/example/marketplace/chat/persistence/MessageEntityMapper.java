package com.example.marketplace.chat.persistence;

import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.domain.UserAccount;
import com.example.marketplace.chat.domain.UserRole;
import com.example.marketplace.chat.domain.UserSummary;
import org.springframework.stereotype.Component;

@Component
public class MessageEntityMapper {

    public MessageEntity toEntity(Message message) {
        MessageEntity entity = new MessageEntity();
        entity.setId(message.getId());
        entity.setSenderId(message.getSenderId());
        entity.setReceiverId(message.getReceiverId());
        entity.setText(message.getText());
        entity.setListingId(message.getListingId());
        entity.setRead(message.isRead());
        entity.setDelivered(message.isDelivered());
        entity.setDeliveredAt(message.getDeliveredAt());
        entity.setCreatedAt(message.getCreatedAt());
        entity.setUpdatedAt(message.getUpdatedAt());
        return entity;
    }

    public Message toMessage(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        return Message.builder()
                .id(entity.getId())
                .senderId(entity.getSenderId())
                .receiverId(entity.getReceiverId())
                .text(entity.getText())
                .listingId(entity.getListingId())
                .read(entity.isRead())
                .delivered(entity.isDelivered())
                .deliveredAt(entity.getDeliveredAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public UserSummary toSummary(UserEntity entity) {
        return UserSummary.builder()
                .id(entity.getId())
                .name(entity.getName())
                .photo(entity.getPhoto())
                .build();
    }

    public UserAccount toAccount(UserEntity entity) {
        return UserAccount.builder()
                .id(entity.getId())
                .name(entity.getName())
                .role(entity.getRole() != null ? entity.getRole() : UserRole.USER)
                .active(entity.isActive())
                .suspended(entity.isSuspended())
                .build();
    }
}
