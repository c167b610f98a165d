package com.ai.commerce.service;

public final class RateLimitStatus {

    public static final String WITHIN_LIMITS = "within_limits";
    public static final String SPAM_COOLDOWN = "spam_cooldown";
    public static final String ABUSE_COOLDOWN = "abuse_cooldown";
    public static final String HOURLY_LIMIT_EXCEEDED = "hourly_limit_exceeded";
    public static final String MINUTE_LIMIT_EXCEEDED = "minute_limit_exceeded";

    private final boolean allowed;
    private final String reason;
    private final long retryAfterSeconds;

    private RateLimitStatus(boolean allowed, String reason, long retryAfterSeconds) {
        this.allowed = allowed;
        this.reason = reason;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitStatus allowed() {
        return new RateLimitStatus(true, WITHIN_LIMITS, 0);
    }

    public static RateLimitStatus limited(String reason, long retryAfterSeconds) {
        return new RateLimitStatus(false, reason, retryAfterSeconds);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public String toString() {
        return "RateLimitStatus{allowed=" + allowed + ", reason=" + reason + ", retryAfter=" + retryAfterSeconds + "s}";
    }
}
