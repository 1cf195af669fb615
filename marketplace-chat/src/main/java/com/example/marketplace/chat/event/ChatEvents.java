package com.example.marketplace.chat.event;

/**
 * Socket event names exchanged with chat clients.
 */
public final class ChatEvents {

    // client -> server
    public static final String SEND_MESSAGE = "send_message";
    public static final String TYPING = "typing";
    public static final String STOP_TYPING = "stop_typing";
    public static final String MARK_READ = "mark_read";

    // server -> client
    public static final String RECEIVE_MESSAGE = "receive_message";
    public static final String MESSAGE_SENT = "message_sent";
    public static final String MESSAGE_DELIVERED = "message_delivered";
    public static final String MESSAGE_ERROR = "message_error";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOP_TYPING = "user_stop_typing";
    public static final String MESSAGES_READ = "messages_read";
    public static final String AUTH_ERROR = "auth_error";

    private ChatEvents() {}
}
