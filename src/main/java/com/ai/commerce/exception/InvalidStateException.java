package com.ai.commerce.exception;

/**
 * Conversation state violates an invariant (bad enum, confidence out of range, negative counter).
 * Never recovered silently.
 */
public class InvalidStateException extends RuntimeException {

    private final String field;

    public InvalidStateException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public InvalidStateException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
