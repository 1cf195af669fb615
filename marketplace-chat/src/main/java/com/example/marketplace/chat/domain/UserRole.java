package com.example.marketplace.chat.domain;

public enum UserRole {
    USER,
    ADMIN
}
