package com.example.marketplace.chat.controller;

import com.example.marketplace.chat.config.JwtAuthenticationFilter;
import com.example.marketplace.chat.domain.ConversationSummary;
import com.example.marketplace.chat.domain.EnrichedMessage;
import com.example.marketplace.chat.domain.MessagePage;
import com.example.marketplace.chat.domain.PresenceSnapshot;
import com.example.marketplace.chat.dto.SendMessageRequest;
import com.example.marketplace.chat.dto.UnreadCountResponse;
import com.example.marketplace.chat.service.ConversationAggregator;
import com.example.marketplace.chat.service.MessageHistoryService;
import com.example.marketplace.chat.service.PresenceService;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
@SecurityRequirement(name = "bearerAuth")
public class MessageController {

    private final MessageHistoryService messageHistoryService;
    private final ConversationAggregator conversationAggregator;
    private final PresenceService presenceService;

    public MessageController(
            MessageHistoryService messageHistoryService,
            ConversationAggregator conversationAggregator,
            PresenceService presenceService) {
        this.messageHistoryService = messageHistoryService;
        this.conversationAggregator = conversationAggregator;
        this.presenceService = presenceService;
    }

    @PostMapping
    public ResponseEntity<EnrichedMessage> sendMessage(
            @RequestAttribute(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTRIBUTE) String userId,
            @Valid @RequestBody SendMessageRequest request) {
        EnrichedMessage message = messageHistoryService.send(
                userId, request.getReceiverId(), request.getText(), request.getListingId());
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @GetMapping("/conversations")
    public ResponseEntity<List<ConversationSummary>> getConversations(
            @RequestAttribute(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTRIBUTE) String userId) {
        return ResponseEntity.ok(conversationAggregator.listConversations(userId));
    }

    @GetMapping("/unread/count")
    public ResponseEntity<UnreadCountResponse> getUnreadCount(
            @RequestAttribute(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTRIBUTE) String userId) {
        return ResponseEntity.ok(new UnreadCountResponse(messageHistoryService.unreadCount(userId)));
    }

    @GetMapping("/presence/{counterpartId}")
    public ResponseEntity<PresenceSnapshot> getPresence(@PathVariable String counterpartId) {
        return ResponseEntity.ok(presenceService.snapshot(counterpartId));
    }

    @GetMapping("/{counterpartId}")
    public ResponseEntity<MessagePage> getMessages(
            @RequestAttribute(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTRIBUTE) String userId,
            @PathVariable String counterpartId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(messageHistoryService.getMessages(userId, counterpartId, page, limit));
    }
}
