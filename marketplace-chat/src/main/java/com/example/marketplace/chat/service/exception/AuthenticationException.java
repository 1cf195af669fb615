package com.example.marketplace.chat.service.exception;

/**
 * Raised when a socket handshake presents no usable credential. No identity is bound.
 */
public class AuthenticationException extends RuntimeException {

    public enum Reason {
        MISSING_TOKEN("Authentication error: No token provided"),
        INVALID_TOKEN("Authentication error: Invalid token"),
        EXPIRED_TOKEN("Authentication error: Invalid token");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Reason reason;

    public AuthenticationException(Reason reason) {
        this(reason, null);
    }

    public AuthenticationException(Reason reason, Throwable cause) {
        super(reason.getMessage(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
