package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.UserAccount;
import com.example.marketplace.chat.domain.UserSummary;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of marketplace accounts.
 */
public interface UserDirectory {

    /** Display fields keyed by user id. Unknown ids are absent from the result. */
    Map<String, UserSummary> summaries(Collection<String> userIds);

    Optional<UserAccount> findAccount(String userId);
}
