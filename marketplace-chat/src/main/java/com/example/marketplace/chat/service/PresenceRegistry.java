package com.example.marketplace.chat.service;

import java.util.Optional;

/**
 * Maps each authenticated identity to its live connections ("room"). A connection belongs to
 * exactly one identity; an identity may hold any number of connections.
 *
 * <p>The default implementation lives in this process only. Running several chat nodes needs an
 * implementation backed by a shared fan-out layer.
 */
public interface PresenceRegistry {

    /** Adds the connection to the identity's room. Joining twice with the same connection is a no-op. */
    void join(String identity, ChatConnection connection);

    /**
     * Removes the connection from whatever room holds it.
     *
     * @return the identity the connection was bound to, if any
     */
    Optional<String> leave(ChatConnection connection);

    int occupancy(String identity);

    /** Sends the event to every live connection of the identity. An empty room drops the event. */
    void broadcast(String identity, String event, Object payload);
}
