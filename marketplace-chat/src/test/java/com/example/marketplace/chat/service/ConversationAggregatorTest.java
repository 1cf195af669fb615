package com.example.marketplace.chat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

import com.example.marketplace.chat.domain.ConversationSummary;
import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.domain.UserSummary;
import com.example.marketplace.chat.service.exception.ServiceException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ConversationAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private MessageStore messageStore;

    @Mock
    private UserDirectory userDirectory;

    private ConversationAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ConversationAggregator(messageStore, new MessageReadModel(userDirectory));
    }

    @Test
    void keepsLatestMessagePerCounterpartNewestConversationFirst() {
        when(messageStore.findAllInvolving("me")).thenReturn(List.of(
                message("a1", "me", "alice", 10),
                message("b1", "bob", "me", 20),
                message("a2", "alice", "me", 30),
                message("c1", "me", "carol", 5)));
        when(userDirectory.summaries(anyCollection())).thenReturn(Map.of(
                "alice", UserSummary.builder().id("alice").name("Alice").build(),
                "me", UserSummary.builder().id("me").name("Me").build()));

        List<ConversationSummary> conversations = aggregator.listConversations("me");

        assertThat(conversations)
                .extracting(ConversationSummary::getCounterpartId)
                .containsExactly("alice", "bob", "carol");
        assertThat(conversations.get(0).getLastMessage().getId()).isEqualTo("a2");
        assertThat(conversations.get(0).getLastMessage().getSender().getName()).isEqualTo("Alice");
        assertThat(conversations.get(1).getLastMessage().getId()).isEqualTo("b1");
        assertThat(conversations.get(1).getLastMessage().getSender()).isEqualTo(UserSummary.unresolved("bob"));
    }

    @Test
    void equalTimestampsAreOrderedById() {
        when(messageStore.findAllInvolving("me")).thenReturn(List.of(
                message("m-a", "me", "alice", 10),
                message("m-b", "bob", "me", 10)));
        when(userDirectory.summaries(anyCollection())).thenReturn(Map.of());

        List<ConversationSummary> conversations = aggregator.listConversations("me");

        assertThat(conversations)
                .extracting(ConversationSummary::getCounterpartId)
                .containsExactly("bob", "alice");
    }

    @Test
    void userWithoutMessagesHasNoConversations() {
        when(messageStore.findAllInvolving("me")).thenReturn(List.of());

        assertThat(aggregator.listConversations("me")).isEmpty();
    }

    @Test
    void requiresUserId() {
        assertThatThrownBy(() -> aggregator.listConversations(""))
                .isInstanceOfSatisfying(ServiceException.class,
                        ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    private static Message message(String id, String senderId, String receiverId, long minutes) {
        Instant createdAt = T0.plusSeconds(minutes * 60);
        return Message.builder()
                .id(id)
                .senderId(senderId)
                .receiverId(receiverId)
                .text("text of " + id)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }
}
