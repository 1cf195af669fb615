package com.example.marketplace.chat.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.corundumstudio.socketio.listener.ExceptionListenerAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

/**
 * Embedded Socket.IO server carrying the real-time chat events. It listens on its own port, next to
 * the servlet container.
 */
@Slf4j
@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    // generous for a 1000 character message plus its JSON envelope
    private static final int MAX_FRAME_PAYLOAD_BYTES = 64 * 1024;

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            @Value("${chat.socketio.host:0.0.0.0}") String host,
            @Value("${chat.socketio.port:9094}") int port,
            @Value("${chat.socketio.ping-interval-ms:25000}") int pingInterval,
            @Value("${chat.socketio.ping-timeout-ms:20000}") int pingTimeout,
            ChatProperties chatProperties,
            ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(host);
        configuration.setPort(port);
        configuration.setOrigin(socketOrigin(chatProperties.getCors().getAllowedOrigins()));
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setPingInterval(pingInterval);
        configuration.setPingTimeout(pingTimeout);
        configuration.setMaxFramePayloadLength(MAX_FRAME_PAYLOAD_BYTES);
        configuration.setMaxHttpContentLength(MAX_FRAME_PAYLOAD_BYTES);
        configuration.getSocketConfig().setReuseAddress(true);
        configuration.setJsonSupport(new SpringJacksonJsonSupport(objectMapper));
        configuration.setExceptionListener(new LoggingExceptionListener());

        server = new SocketIOServer(configuration);
        server.start();
        log.info("Socket.IO chat server listening on {}:{}", host, port);
        return server;
    }

    // netty-socketio accepts a single origin; with several configured it echoes the caller's Origin header
    private String socketOrigin(List<String> allowedOrigins) {
        if (allowedOrigins == null || allowedOrigins.size() != 1) {
            return null;
        }
        return allowedOrigins.get(0);
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }

    static class LoggingExceptionListener extends ExceptionListenerAdapter {

        @Override
        public void onEventException(Exception e, List<Object> args, SocketIOClient client) {
            log.error("Socket event handler failed for {}", client.getSessionId(), e);
        }

        @Override
        public void onConnectException(Exception e, SocketIOClient client) {
            log.error("Socket connect handler failed for {}", client.getSessionId(), e);
        }

        @Override
        public void onDisconnectException(Exception e, SocketIOClient client) {
            log.error("Socket disconnect handler failed for {}", client.getSessionId(), e);
        }

        @Override
        public void onAuthException(Throwable e, SocketIOClient client) {
            log.warn("Socket handshake authorization failed for {}", client.getSessionId(), e);
        }
    }
}
