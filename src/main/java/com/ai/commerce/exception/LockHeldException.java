package com.ai.commerce.exception;

/**
 * Another worker already holds the processing lock for a message fingerprint.
 * Callers skip the message; they do not retry inline.
 */
public class LockHeldException extends RuntimeException {

    private final String fingerprint;
    private final String owner;

    public LockHeldException(String fingerprint, String owner) {
        super("Message " + fingerprint + " is already being processed" + (owner != null ? " by " + owner : ""));
        this.fingerprint = fingerprint;
        this.owner = owner;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getOwner() {
        return owner;
    }
}
