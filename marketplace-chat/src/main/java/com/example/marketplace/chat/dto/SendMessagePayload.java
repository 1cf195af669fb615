package com.example.marketplace.chat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessagePayload {

    private String receiverId;

    private String text;

    private String listingId;
}
