package com.example.marketplace.chat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotBlank
    private String receiverId;

    @NotBlank
    @Size(max = 1000)
    private String text;

    private String listingId;
}
