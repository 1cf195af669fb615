package com.example.marketplace.chat.event;

public enum MessageEventType {
    MESSAGE_SENT,
    MESSAGE_DELIVERED,
    MESSAGES_READ
}
