package com.ai.commerce.exception;

/**
 * External classifier could not produce a usable result. Callers fall back to keyword heuristics.
 */
public class ClassifierFailureException extends RuntimeException {

    private final boolean malformedResponse;

    public ClassifierFailureException(String message, boolean malformedResponse) {
        super(message);
        this.malformedResponse = malformedResponse;
    }

    public ClassifierFailureException(String message, boolean malformedResponse, Throwable cause) {
        super(message, cause);
        this.malformedResponse = malformedResponse;
    }

    /** True when the model answered but the reply could not be parsed into the expected shape. */
    public boolean isMalformedResponse() {
        return malformedResponse;
    }
}
