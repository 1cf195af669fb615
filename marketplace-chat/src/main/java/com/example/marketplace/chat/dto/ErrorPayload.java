package com.example.marketplace.chat.dto;

import lombok.Value;

@Value
public class ErrorPayload {
    String message;
}
