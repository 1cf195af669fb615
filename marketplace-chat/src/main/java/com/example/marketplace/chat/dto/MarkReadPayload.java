package com.example.marketplace.chat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkReadPayload {

    /** Author of the messages being marked read. */
    private String senderId;
}
