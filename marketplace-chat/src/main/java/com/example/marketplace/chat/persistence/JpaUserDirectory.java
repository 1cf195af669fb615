package com.example.marketplace.chat.persistence;

import com.example.marketplace.chat.domain.UserAccount;
import com.example.marketplace.chat.domain.UserSummary;
import com.example.marketplace.chat.service.UserDirectory;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final UserJpaRepository userJpaRepository;
    private final MessageEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Map<String, UserSummary> summaries(Collection<String> userIds) {
        if (CollectionUtils.isEmpty(userIds)) {
            return Map.of();
        }
        return userJpaRepository.findAllById(userIds).stream()
                .map(mapper::toSummary)
                .collect(Collectors.toUnmodifiableMap(UserSummary::getId, Function.identity()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findAccount(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return userJpaRepository.findById(userId).map(mapper::toAccount);
    }
}
