package com.example.marketplace.chat.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Request-scoped failure carrying the HTTP status it maps to and, for client errors, a stable
 * machine-readable code.
 */
public class ServiceException extends RuntimeException {

    public static final String INVALID_MESSAGE = "invalid_message";
    public static final String INVALID_PAGINATION = "invalid_pagination";
    public static final String MISSING_PARTICIPANT = "missing_participant";

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        // client errors are expected traffic; only server errors keep their stack trace
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public static ServiceException badRequest(String errorCode, String message) {
        return new ServiceException(HttpStatus.BAD_REQUEST, message, errorCode);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
