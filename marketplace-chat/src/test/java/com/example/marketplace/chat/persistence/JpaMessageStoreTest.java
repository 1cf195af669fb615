package com.example.marketplace.chat.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.marketplace.chat.domain.Message;
import com.example.marketplace.chat.domain.UserSummary;
import com.example.marketplace.chat.service.exception.ServiceException;
import com.example.marketplace.chat.support.SteppingClock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;

@DataJpaTest
@Import({JpaMessageStore.class, JpaUserDirectory.class, MessageEntityMapper.class})
class JpaMessageStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00.123456789Z");

    @TestConfiguration
    static class ClockConfig {

        @Bean
        Clock clock() {
            return new SteppingClock(START, Duration.ofSeconds(1));
        }
    }

    @Autowired
    private JpaMessageStore store;

    @Autowired
    private JpaUserDirectory userDirectory;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void createPersistsTrimmedUnreadUndeliveredMessage() {
        Message created = store.create("seller", "buyer", "  Still available  ", "listing-1");

        Message stored = store.findById(created.getId()).orElseThrow();
        assertThat(stored.getText()).isEqualTo("Still available");
        assertThat(stored.getListingId()).isEqualTo("listing-1");
        assertThat(stored.isRead()).isFalse();
        assertThat(stored.isDelivered()).isFalse();
        assertThat(stored.getDeliveredAt()).isNull();
        assertThat(stored.getCreatedAt()).isEqualTo(stored.getUpdatedAt()).isEqualTo(created.getCreatedAt());
    }

    @Test
    void timestampsMatchWhatTheDatabaseKeeps() {
        Message created = store.create("seller", "buyer", "hello", null);
        Instant deliveredAt = created.getCreatedAt().plusMillis(1500);
        store.markDelivered(created.getId(), deliveredAt.plusNanos(789));
        entityManager.clear();

        Message stored = store.findById(created.getId()).orElseThrow();
        assertThat(created.getCreatedAt().getNano() % 1000).isZero();
        assertThat(stored.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(stored.getDeliveredAt()).isEqualTo(deliveredAt);
    }

    @Test
    void createRejectsInvalidMessages() {
        assertThatThrownBy(() -> store.create("seller", "buyer", "   ", null))
                .isInstanceOfSatisfying(ServiceException.class,
                        ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST))
                .hasMessage("Message text is required");
        assertThatThrownBy(() -> store.create("seller", "buyer", "x".repeat(1001), null))
                .isInstanceOf(ServiceException.class)
                .hasMessage("Message cannot exceed 1000 characters");
        assertThatThrownBy(() -> store.create("seller", null, "hello", null))
                .isInstanceOf(ServiceException.class)
                .hasMessage("Sender and receiver are required");
    }

    @Test
    void acceptsTextAtMaximumLength() {
        Message created = store.create("seller", "buyer", "x".repeat(1000), null);

        assertThat(store.findById(created.getId()).orElseThrow().getText()).hasSize(1000);
    }

    @Test
    void deliveryIsRecordedOnlyOnce() {
        Message created = store.create("seller", "buyer", "hello", null);
        Instant firstDelivery = created.getCreatedAt().plusSeconds(5);

        Message delivered = store.markDelivered(created.getId(), firstDelivery).orElseThrow();
        Message again = store.markDelivered(created.getId(), firstDelivery.plusSeconds(60)).orElseThrow();

        assertThat(delivered.isDelivered()).isTrue();
        assertThat(delivered.getDeliveredAt()).isEqualTo(firstDelivery);
        assertThat(again.getDeliveredAt()).isEqualTo(firstDelivery);
    }

    @Test
    void deliveryNeverPrecedesCreation() {
        Message created = store.create("seller", "buyer", "hello", null);

        Message delivered = store.markDelivered(created.getId(), created.getCreatedAt().minusSeconds(30)).orElseThrow();

        assertThat(delivered.getDeliveredAt()).isEqualTo(created.getCreatedAt());
    }

    @Test
    void markDeliveredOfUnknownMessageIsEmpty() {
        assertThat(store.markDelivered("missing", START)).isEmpty();
    }

    @Test
    void markReadOnlyTouchesOneDirectionAndIsIdempotent() {
        Message first = store.create("seller", "buyer", "one", null);
        Message second = store.create("seller", "buyer", "two", null);
        Message reply = store.create("buyer", "seller", "reply", null);
        Message elsewhere = store.create("seller", "someone-else", "other", null);

        assertThat(store.markRead("seller", "buyer")).isEqualTo(2);
        assertThat(store.markRead("seller", "buyer")).isZero();

        assertThat(store.findById(first.getId()).orElseThrow().isRead()).isTrue();
        assertThat(store.findById(second.getId()).orElseThrow().isRead()).isTrue();
        assertThat(store.findById(reply.getId()).orElseThrow().isRead()).isFalse();
        assertThat(store.findById(elsewhere.getId()).orElseThrow().isRead()).isFalse();
    }

    @Test
    void conversationPagesWalkBackFromNewest() {
        Message m1 = store.create("seller", "buyer", "1", null);
        Message m2 = store.create("buyer", "seller", "2", null);
        Message m3 = store.create("seller", "buyer", "3", null);
        Message m4 = store.create("buyer", "seller", "4", null);
        Message m5 = store.create("seller", "buyer", "5", null);
        store.create("seller", "someone-else", "not in this conversation", null);

        assertThat(store.findConversationPage("buyer", "seller", 1, 2))
                .extracting(Message::getId)
                .containsExactly(m5.getId(), m4.getId());
        assertThat(store.findConversationPage("seller", "buyer", 2, 2))
                .extracting(Message::getId)
                .containsExactly(m3.getId(), m2.getId());
        assertThat(store.findConversationPage("buyer", "seller", 3, 2))
                .extracting(Message::getId)
                .containsExactly(m1.getId());
        assertThat(store.findConversationPage("buyer", "seller", 4, 2)).isEmpty();
        assertThat(store.countConversation("buyer", "seller")).isEqualTo(5);
    }

    @Test
    void findAllInvolvingReturnsBothDirectionsNewestFirst() {
        Message sent = store.create("seller", "buyer", "1", null);
        Message received = store.create("carol", "seller", "2", null);
        store.create("buyer", "carol", "unrelated", null);

        List<Message> messages = store.findAllInvolving("seller");

        assertThat(messages).extracting(Message::getId).containsExactly(received.getId(), sent.getId());
    }

    @Test
    void countsUnreadAddressedToUser() {
        store.create("seller", "buyer", "1", null);
        store.create("carol", "buyer", "2", null);
        store.create("buyer", "seller", "3", null);
        store.markRead("carol", "buyer");

        assertThat(store.countUnread("buyer")).isEqualTo(1);
        assertThat(store.countUnread("seller")).isEqualTo(1);
        assertThat(store.countUnread("nobody")).isZero();
    }

    @Test
    void userDirectoryExposesDisplayFieldsOnly() {
        entityManager.persist(user("u1", "Alice", "alice@example.com", "alice.png"));
        entityManager.persist(user("u2", "Bob", "bob@example.com", null));
        entityManager.flush();

        Map<String, UserSummary> summaries = userDirectory.summaries(List.of("u1", "u2", "ghost"));

        assertThat(summaries).containsOnlyKeys("u1", "u2");
        assertThat(summaries.get("u1")).isEqualTo(UserSummary.builder().id("u1").name("Alice").photo("alice.png").build());
        assertThat(userDirectory.findAccount("u2")).hasValueSatisfying(account -> {
            assertThat(account.isActive()).isTrue();
            assertThat(account.isSuspended()).isFalse();
        });
        assertThat(userDirectory.findAccount("ghost")).isEmpty();
    }

    private static UserEntity user(String id, String name, String email, String photo) {
        UserEntity entity = new UserEntity();
        entity.setId(id);
        entity.setName(name);
        entity.setEmail(email);
        entity.setPassword("$2a$10$hash");
        entity.setPhoto(photo);
        entity.setCreatedAt(START);
        return entity;
    }
}
