package com.example.marketplace.chat.service;

/**
 * One live client connection, as seen by the chat services.
 */
public interface ChatConnection {

    /** Stable for the lifetime of the connection and unique among live connections. */
    String getId();

    void send(String event, Object payload);
}
