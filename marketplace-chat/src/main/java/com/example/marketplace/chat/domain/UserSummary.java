package com.example.marketplace.chat.domain;

import java.io.Serializable;
import lombok.Builder;
import lombok.Value;

/**
 * Display fields of a user that are safe to embed in chat payloads.
 */
@Value
@Builder
public class UserSummary implements Serializable {

    String id;
    String name;
    String photo;

    public static UserSummary unresolved(String id) {
        return UserSummary.builder().id(id).build();
    }
}
