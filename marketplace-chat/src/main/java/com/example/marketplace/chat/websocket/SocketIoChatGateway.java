package com.example.marketplace.chat.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.AuthTokenResult;
import com.corundumstudio.socketio.HandshakeData;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.namespace.Namespace;
import com.example.marketplace.chat.dto.ErrorPayload;
import com.example.marketplace.chat.dto.MarkReadPayload;
import com.example.marketplace.chat.dto.SendMessagePayload;
import com.example.marketplace.chat.dto.TypingPayload;
import com.example.marketplace.chat.event.ChatEvents;
import com.example.marketplace.chat.service.ChatConnection;
import com.example.marketplace.chat.service.ConnectionAuthenticator;
import com.example.marketplace.chat.service.DispatchResult;
import com.example.marketplace.chat.service.MessageDispatcher;
import com.example.marketplace.chat.service.PresenceRegistry;
import com.example.marketplace.chat.service.PresenceService;
import com.example.marketplace.chat.service.exception.AuthenticationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Binds Socket.IO connections to marketplace users. The credential is read from the connect packet's
 * auth payload ({@code {auth: {token}}}), then the {@code token} URL parameter, then an
 * {@code Authorization: Bearer} handshake header. A refused connection never joins a room: during the
 * auth step it gets a connect error, and a client that skipped that step gets an {@code auth_error}
 * event and is closed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoChatGateway {

    static final String IDENTITY_KEY = "userId";

    private static final String AUTH_TOKEN_FIELD = "token";
    private static final String PARAM_TOKEN = "token";
    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SocketIOServer socketIOServer;
    private final ConnectionAuthenticator connectionAuthenticator;
    private final PresenceRegistry presenceRegistry;
    private final PresenceService presenceService;
    private final MessageDispatcher messageDispatcher;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.getNamespace(Namespace.DEFAULT_NAME).addAuthTokenListener(this::authorizeHandshake);
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(ChatEvents.SEND_MESSAGE, SendMessagePayload.class, this::handleSend);
        socketIOServer.addEventListener(ChatEvents.TYPING, TypingPayload.class, this::handleTyping);
        socketIOServer.addEventListener(ChatEvents.STOP_TYPING, TypingPayload.class, this::handleStopTyping);
        socketIOServer.addEventListener(ChatEvents.MARK_READ, MarkReadPayload.class, this::handleMarkRead);
    }

    AuthTokenResult authorizeHandshake(Object authData, SocketIOClient client) {
        try {
            String userId = connectionAuthenticator.authenticate(resolveToken(authData, client.getHandshakeData()));
            client.set(IDENTITY_KEY, userId);
            return AuthTokenResult.AuthTokenResultSuccess;
        } catch (AuthenticationException ex) {
            log.warn("Refused socket {}: {} ({})", client.getSessionId(), ex.getMessage(), ex.getReason());
            return new AuthTokenResult(false, new ErrorPayload(ex.getMessage()));
        }
    }

    void handleConnect(SocketIOClient client) {
        String userId = identity(client);
        if (userId == null) {
            try {
                HandshakeData handshake = client.getHandshakeData();
                userId = connectionAuthenticator.authenticate(resolveToken(handshake.getAuthToken(), handshake));
            } catch (AuthenticationException ex) {
                log.warn("Refused socket {}: {} ({})", client.getSessionId(), ex.getMessage(), ex.getReason());
                client.sendEvent(ChatEvents.AUTH_ERROR, new ErrorPayload(ex.getMessage()));
                client.disconnect();
                return;
            }
            client.set(IDENTITY_KEY, userId);
        }

        presenceRegistry.join(userId, new SocketIoChatConnection(client));
        log.info("User {} connected on socket {} ({} live connections)",
                userId, client.getSessionId(), presenceRegistry.occupancy(userId));
    }

    void handleDisconnect(SocketIOClient client) {
        presenceRegistry.leave(new SocketIoChatConnection(client)).ifPresent(userId -> {
            log.info("User {} disconnected from socket {}", userId, client.getSessionId());
            if (presenceRegistry.occupancy(userId) == 0) {
                try {
                    presenceService.markSeen(userId);
                } catch (RuntimeException ex) {
                    log.warn("Could not record last-seen time for {}", userId, ex);
                }
            }
        });
    }

    void handleSend(SocketIOClient client, SendMessagePayload payload, AckRequest ackRequest) {
        ChatConnection origin = new SocketIoChatConnection(client);
        DispatchResult result = messageDispatcher.handleSend(origin, identity(client), payload);
        if (ackRequest != null && ackRequest.isAckRequested()) {
            ackRequest.sendAckData(result);
        }
    }

    void handleTyping(SocketIOClient client, TypingPayload payload, AckRequest ackRequest) {
        if (payload != null) {
            messageDispatcher.typing(identity(client), payload.getReceiverId());
        }
    }

    void handleStopTyping(SocketIOClient client, TypingPayload payload, AckRequest ackRequest) {
        if (payload != null) {
            messageDispatcher.stopTyping(identity(client), payload.getReceiverId());
        }
    }

    void handleMarkRead(SocketIOClient client, MarkReadPayload payload, AckRequest ackRequest) {
        if (payload != null) {
            messageDispatcher.markRead(identity(client), payload.getSenderId());
        }
    }

    private String identity(SocketIOClient client) {
        return client.get(IDENTITY_KEY);
    }

    static String resolveToken(Object authData, HandshakeData handshake) {
        if (authData instanceof Map<?, ?> auth && auth.get(AUTH_TOKEN_FIELD) instanceof String authToken
                && StringUtils.hasText(authToken)) {
            return authToken;
        }
        if (handshake == null) {
            return null;
        }
        String token = handshake.getSingleUrlParam(PARAM_TOKEN);
        if (StringUtils.hasText(token)) {
            return token;
        }
        String authorization = handshake.getHttpHeaders() != null
                ? handshake.getHttpHeaders().get(AUTHORIZATION_HEADER)
                : null;
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(ChatEvents.SEND_MESSAGE);
        socketIOServer.removeAllListeners(ChatEvents.TYPING);
        socketIOServer.removeAllListeners(ChatEvents.STOP_TYPING);
        socketIOServer.removeAllListeners(ChatEvents.MARK_READ);
    }
}
