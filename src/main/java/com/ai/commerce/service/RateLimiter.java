package com.ai.commerce.service;

/**
 * Per (tenant, customer) message throttling and governance cooldowns.
 */
public interface RateLimiter {

    /** Counts the current message and reports whether the customer may proceed. */
    RateLimitStatus checkRateLimit(String tenantId, String customerKey);

    void applySpamCooldown(String tenantId, String customerKey);

    void applyAbuseCooldown(String tenantId, String customerKey);
}
