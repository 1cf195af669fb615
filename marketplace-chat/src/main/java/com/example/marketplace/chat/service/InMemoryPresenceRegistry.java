package com.example.marketplace.chat.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
public class InMemoryPresenceRegistry implements PresenceRegistry {

    // identity -> (connection id -> connection)
    private final Map<String, Map<String, ChatConnection>> rooms = new ConcurrentHashMap<>();
    // connection id -> identity
    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    @Override
    public void join(String identity, ChatConnection connection) {
        if (!StringUtils.hasText(identity) || connection == null) {
            throw new IllegalArgumentException("Identity and connection are required to join a room");
        }
        String bound = bindings.putIfAbsent(connection.getId(), identity);
        if (bound != null && !bound.equals(identity)) {
            throw new IllegalStateException("Connection %s is already bound to another identity".formatted(connection.getId()));
        }
        rooms.compute(identity, (key, room) -> {
            Map<String, ChatConnection> members = room != null ? room : new ConcurrentHashMap<>();
            members.put(connection.getId(), connection);
            return members;
        });
    }

    @Override
    public Optional<String> leave(ChatConnection connection) {
        if (connection == null) {
            return Optional.empty();
        }
        String identity = bindings.remove(connection.getId());
        if (identity == null) {
            return Optional.empty();
        }
        rooms.computeIfPresent(identity, (key, room) -> {
            room.remove(connection.getId());
            return room.isEmpty() ? null : room;
        });
        return Optional.of(identity);
    }

    @Override
    public int occupancy(String identity) {
        if (!StringUtils.hasText(identity)) {
            return 0;
        }
        Map<String, ChatConnection> room = rooms.get(identity);
        return room != null ? room.size() : 0;
    }

    @Override
    public void broadcast(String identity, String event, Object payload) {
        if (!StringUtils.hasText(identity)) {
            return;
        }
        Map<String, ChatConnection> room = rooms.get(identity);
        if (room == null) {
            return;
        }
        List<ChatConnection> members = List.copyOf(room.values());
        for (ChatConnection connection : members) {
            try {
                connection.send(event, payload);
            } catch (RuntimeException ex) {
                log.warn("Failed to emit {} to connection {} of {}", event, connection.getId(), identity, ex);
            }
        }
    }
}
