package com.example.marketplace.chat.service;

import com.example.marketplace.chat.domain.EnrichedMessage;
import lombok.Value;

/**
 * Where a send request ended up, and the message that was confirmed to the sender when one was
 * persisted.
 */
@Value
public class DispatchResult {

    public enum Outcome {
        /** No authenticated sender; nothing was persisted. */
        REJECTED,
        /** Persistence failed; the sender was sent {@code message_error}. */
        FAILED,
        /** The receiver had a live connection and the message is flagged delivered. */
        DELIVERED_IMMEDIATE,
        /** The receiver was offline; the message stays undelivered. */
        QUEUED_UNDELIVERED
    }

    Outcome outcome;
    EnrichedMessage message;

    public static DispatchResult rejected() {
        return new DispatchResult(Outcome.REJECTED, null);
    }

    public static DispatchResult failed() {
        return new DispatchResult(Outcome.FAILED, null);
    }
}
