package com.ai.commerce.service;

import com.ai.commerce.store.InMemoryKeyValueStore;
import com.ai.commerce.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StoreBackedRateLimiter - buckets and cooldowns")
class StoreBackedRateLimiterTest {

    private MutableClock clock;
    private StoreBackedRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:05Z"));
        limiter = new StoreBackedRateLimiter(new InMemoryKeyValueStore(clock), clock, 3, 5, 30, 24);
    }

    @Test
    @DisplayName("The message after the per-minute limit is rejected")
    void testMinuteLimit() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.checkRateLimit("t1", "c1").isAllowed());
        }
        RateLimitStatus status = limiter.checkRateLimit("t1", "c1");

        assertFalse(status.isAllowed());
        assertEquals(RateLimitStatus.MINUTE_LIMIT_EXCEEDED, status.getReason());
        assertEquals(60, status.getRetryAfterSeconds());
    }

    @Test
    @DisplayName("A new minute bucket resets the minute count but not the hour count")
    void testHourLimit() {
        for (int i = 0; i < 3; i++) {
            limiter.checkRateLimit("t1", "c1");
        }
        clock.advance(Duration.ofMinutes(1));
        assertTrue(limiter.checkRateLimit("t1", "c1").isAllowed());
        assertTrue(limiter.checkRateLimit("t1", "c1").isAllowed());

        RateLimitStatus status = limiter.checkRateLimit("t1", "c1");
        assertEquals(RateLimitStatus.HOURLY_LIMIT_EXCEEDED, status.getReason());
    }

    @Test
    @DisplayName("Counters are scoped per tenant and customer")
    void testScoping() {
        for (int i = 0; i < 3; i++) {
            limiter.checkRateLimit("t1", "c1");
        }
        assertTrue(limiter.checkRateLimit("t1", "c2").isAllowed());
        assertTrue(limiter.checkRateLimit("t2", "c1").isAllowed());
    }

    @Test
    @DisplayName("Spam cooldown blocks with the remaining time and then lapses")
    void testSpamCooldown() {
        limiter.applySpamCooldown("t1", "c1");
        clock.advance(Duration.ofMinutes(10));

        RateLimitStatus status = limiter.checkRateLimit("t1", "c1");
        assertEquals(RateLimitStatus.SPAM_COOLDOWN, status.getReason());
        assertEquals(Duration.ofMinutes(20).getSeconds(), status.getRetryAfterSeconds());

        clock.advance(Duration.ofMinutes(20));
        assertTrue(limiter.checkRateLimit("t1", "c1").isAllowed());
    }

    @Test
    @DisplayName("Abuse cooldown takes precedence over spam cooldown")
    void testAbusePrecedence() {
        limiter.applySpamCooldown("t1", "c1");
        limiter.applyAbuseCooldown("t1", "c1");

        assertEquals(RateLimitStatus.ABUSE_COOLDOWN, limiter.checkRateLimit("t1", "c1").getReason());
    }

    @Test
    @DisplayName("Keys are namespaced by tenant and customer")
    void testKey() {
        assertEquals("rate_limit:t1:+254700:spam_cooldown", StoreBackedRateLimiter.key("t1", "+254700", "spam_cooldown"));
    }
}
