package com.example.marketplace.chat.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.example.marketplace.chat.service.ChatConnection;
import java.util.Objects;

/**
 * {@link ChatConnection} over a netty-socketio client. Two instances wrapping the same session are
 * equal.
 */
public class SocketIoChatConnection implements ChatConnection {

    private final SocketIOClient client;

    public SocketIoChatConnection(SocketIOClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String getId() {
        return client.getSessionId().toString();
    }

    @Override
    public void send(String event, Object payload) {
        client.sendEvent(event, payload);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SocketIoChatConnection that)) {
            return false;
        }
        return getId().equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }

    @Override
    public String toString() {
        return "SocketIoChatConnection[" + getId() + "]";
    }
}
