package com.example.marketplace.chat.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.marketplace.chat.config.ChatProperties;
import com.example.marketplace.chat.config.JwtAuthenticationFilter;
import com.example.marketplace.chat.domain.ConversationSummary;
import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.MessagePage;
import com.example.marketplace.chat.domain.PresenceSnapshot;
import com.example.marketplace.chat.domain.UserAccount;
import com.example.marketplace.chat.domain.UserRole;
import com.example.marketplace.chat.domain.UserSummary;
import com.example.marketplace.chat.service.ConversationAggregator;
import com.example.marketplace.chat.service.MessageHistoryService;
import com.example.marketplace.chat.service.PresenceService;
import com.example.marketplace.chat.service.TokenService;
import com.example.marketplace.chat.service.UserDirectory;
import com.example.marketplace.chat.service.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class MessageControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private MessageHistoryService messageHistoryService;

    @Mock
    private ConversationAggregator conversationAggregator;

    @Mock
    private PresenceService presenceService;

    @Mock
    private UserDirectory userDirectory;

    private TokenService tokenService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        tokenService = new TokenService(new ChatProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        mockMvc = MockMvcBuilders
                .standaloneSetup(new MessageController(messageHistoryService, conversationAggregator, presenceService))
                .setControllerAdvice(new RestExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .addFilters(new JwtAuthenticationFilter(tokenService, userDirectory, objectMapper))
                .build();
    }

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/messages/conversations"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value(
                        "Missing Authorization header. Include Authorization: Bearer <token> in requests."));
    }

    @Test
    void garbageTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/messages/conversations").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid token"));
    }

    @Test
    void unknownUserIsUnauthorized() throws Exception {
        when(userDirectory.findAccount("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/messages/conversations").header(HttpHeaders.AUTHORIZATION, bearer("ghost")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("User not found"));
    }

    @Test
    void deactivatedUserIsUnauthorized() throws Exception {
        when(userDirectory.findAccount("buyer")).thenReturn(Optional.of(account("buyer", false, false)));

        mockMvc.perform(get("/api/messages/conversations").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("User account is deactivated"));
    }

    @Test
    void suspendedUserIsForbidden() throws Exception {
        when(userDirectory.findAccount("buyer")).thenReturn(Optional.of(account("buyer", true, true)));

        mockMvc.perform(get("/api/messages/conversations").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("User account is suspended"));
        verify(conversationAggregator, never()).listConversations(anyString());
    }

    @Test
    void listsConversationsOfCaller() throws Exception {
        authenticate("buyer");
        when(conversationAggregator.listConversations("buyer")).thenReturn(List.of(
                ConversationSummary.builder()
                        .counterpartId("seller")
                        .lastMessage(message("m1", "seller", "buyer"))
                        .build()));

        mockMvc.perform(get("/api/messages/conversations").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].counterpartId").value("seller"))
                .andExpect(jsonPath("$[0].lastMessage.sender.name").value("Sam"))
                .andExpect(jsonPath("$[0].lastMessage.isRead").value(false));
    }

    @Test
    void returnsHistoryPage() throws Exception {
        authenticate("buyer");
        when(messageHistoryService.getMessages("buyer", "seller", 2, 10)).thenReturn(MessagePage.builder()
                .messages(List.of(message("m1", "seller", "buyer")))
                .page(2)
                .limit(10)
                .total(11)
                .pages(2)
                .build());

        mockMvc.perform(get("/api/messages/seller")
                        .param("page", "2")
                        .param("limit", "10")
                        .header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(2))
                .andExpect(jsonPath("$.pages").value(2))
                .andExpect(jsonPath("$.total").value(11))
                .andExpect(jsonPath("$.messages[0].id").value("m1"))
                .andExpect(jsonPath("$.messages[0].isDelivered").value(false));
    }

    @Test
    void historyValidationErrorIsBadRequest() throws Exception {
        authenticate("buyer");
        when(messageHistoryService.getMessages("buyer", "seller", 0, null))
                .thenThrow(ServiceException.badRequest(ServiceException.INVALID_PAGINATION, "Page must be 1 or greater"));

        mockMvc.perform(get("/api/messages/seller").param("page", "0").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Page must be 1 or greater"))
                .andExpect(jsonPath("$.code").value("invalid_pagination"));
    }

    @Test
    void nonNumericPageIsBadRequest() throws Exception {
        authenticate("buyer");

        mockMvc.perform(get("/api/messages/seller").param("page", "first").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void returnsUnreadCount() throws Exception {
        authenticate("buyer");
        when(messageHistoryService.unreadCount("buyer")).thenReturn(4L);

        mockMvc.perform(get("/api/messages/unread/count").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(4));
    }

    @Test
    void returnsPresence() throws Exception {
        authenticate("buyer");
        when(presenceService.snapshot("seller")).thenReturn(PresenceSnapshot.builder()
                .userId("seller")
                .online(false)
                .connections(0)
                .lastSeen(NOW)
                .build());

        mockMvc.perform(get("/api/messages/presence/seller").header(HttpHeaders.AUTHORIZATION, bearer("buyer")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.online").value(false))
                .andExpect(jsonPath("$.lastSeen").value("2024-05-01T10:15:30Z"));
    }

    @Test
    void sendingMessageReturnsCreated() throws Exception {
        authenticate("buyer");
        when(messageHistoryService.send("buyer", "seller", "Is it available?", "listing-3"))
                .thenReturn(message("m7", "buyer", "seller"));

        mockMvc.perform(post("/api/messages")
                        .header(HttpHeaders.AUTHORIZATION, bearer("buyer"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverId\":\"seller\",\"text\":\"Is it available?\",\"listingId\":\"listing-3\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("m7"))
                .andExpect(jsonPath("$.senderId").value("buyer"));
    }

    @Test
    void sendingBlankMessageIsRejected() throws Exception {
        authenticate("buyer");

        mockMvc.perform(post("/api/messages")
                        .header(HttpHeaders.AUTHORIZATION, bearer("buyer"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverId\":\"seller\",\"text\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
        verify(messageHistoryService, never()).send(anyString(), anyString(), any(), any());
    }

    private void authenticate(String userId) {
        when(userDirectory.findAccount(userId)).thenReturn(Optional.of(account(userId, true, false)));
    }

    private String bearer(String userId) {
        return "Bearer " + tokenService.issue(userId);
    }

    private static UserAccount account(String id, boolean active, boolean suspended) {
        return UserAccount.builder()
                .id(id)
                .name(id)
                .role(UserRole.USER)
                .active(active)
                .suspended(suspended)
                .build();
    }

    private static EnrichedMessage message(String id, String senderId, String receiverId) {
        return EnrichedMessage.builder()
                .id(id)
                .senderId(senderId)
                .receiverId(receiverId)
                .sender(UserSummary.builder().id(senderId).name("Sam").build())
                .receiver(UserSummary.unresolved(receiverId))
                .text("Is it available?")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
