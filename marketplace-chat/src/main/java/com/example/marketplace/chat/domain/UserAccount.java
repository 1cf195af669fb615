package com.example.marketplace.chat.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Account state consulted when authenticating REST callers.
 */
@Value
@Builder
public class UserAccount {

    String id;
    String name;
    UserRole role;
    boolean active;
    boolean suspended;
}
