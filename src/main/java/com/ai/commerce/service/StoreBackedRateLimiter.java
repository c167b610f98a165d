package com.ai.commerce.service;

import com.ai.commerce.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Rate limiter over the shared key/value store. Cooldowns are TTL'd marker keys holding their expiry;
 * message counts use per-minute and per-hour buckets incremented atomically.
 */
@Service
public class StoreBackedRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedRateLimiter.class);

    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MINUTE_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

    private final KeyValueStore store;
    private final Clock clock;
    private final int messagesPerMinute;
    private final int messagesPerHour;
    private final Duration spamCooldown;
    private final Duration abuseCooldown;

    public StoreBackedRateLimiter(KeyValueStore store,
                                  Clock clock,
                                  @Value("${orchestrator.rate-limit.messages-per-minute:10}") int messagesPerMinute,
                                  @Value("${orchestrator.rate-limit.messages-per-hour:60}") int messagesPerHour,
                                  @Value("${orchestrator.rate-limit.spam-cooldown-minutes:30}") long spamCooldownMinutes,
                                  @Value("${orchestrator.rate-limit.abuse-cooldown-hours:24}") long abuseCooldownHours) {
        this.store = store;
        this.clock = clock;
        this.messagesPerMinute = messagesPerMinute;
        this.messagesPerHour = messagesPerHour;
        this.spamCooldown = Duration.ofMinutes(spamCooldownMinutes);
        this.abuseCooldown = Duration.ofHours(abuseCooldownHours);
    }

    @Override
    public RateLimitStatus checkRateLimit(String tenantId, String customerKey) {
        Instant now = clock.instant();

        RateLimitStatus cooldown = activeCooldown(key(tenantId, customerKey, "abuse_cooldown"), RateLimitStatus.ABUSE_COOLDOWN, now);
        if (cooldown == null) {
            cooldown = activeCooldown(key(tenantId, customerKey, "spam_cooldown"), RateLimitStatus.SPAM_COOLDOWN, now);
        }
        if (cooldown != null) {
            return cooldown;
        }

        long hourCount = store.increment(key(tenantId, customerKey, "hour:" + HOUR_BUCKET.format(now)), Duration.ofHours(1));
        long minuteCount = store.increment(key(tenantId, customerKey, "minute:" + MINUTE_BUCKET.format(now)), Duration.ofMinutes(1));

        if (hourCount > messagesPerHour) {
            log.info("Hourly limit hit for {}:{} ({} messages)", tenantId, customerKey, hourCount);
            return RateLimitStatus.limited(RateLimitStatus.HOURLY_LIMIT_EXCEEDED, 3600);
        }
        if (minuteCount > messagesPerMinute) {
            log.info("Minute limit hit for {}:{} ({} messages)", tenantId, customerKey, minuteCount);
            return RateLimitStatus.limited(RateLimitStatus.MINUTE_LIMIT_EXCEEDED, 60);
        }
        return RateLimitStatus.allowed();
    }

    @Override
    public void applySpamCooldown(String tenantId, String customerKey) {
        applyCooldown(key(tenantId, customerKey, "spam_cooldown"), spamCooldown);
        log.info("Spam cooldown applied to {}:{} for {}", tenantId, customerKey, spamCooldown);
    }

    @Override
    public void applyAbuseCooldown(String tenantId, String customerKey) {
        applyCooldown(key(tenantId, customerKey, "abuse_cooldown"), abuseCooldown);
        log.warn("Abuse cooldown applied to {}:{} for {}", tenantId, customerKey, abuseCooldown);
    }

    private void applyCooldown(String key, Duration duration) {
        Instant until = clock.instant().plus(duration);
        store.set(key, Long.toString(until.getEpochSecond()), duration);
    }

    private RateLimitStatus activeCooldown(String key, String reason, Instant now) {
        return store.get(key)
                .map(until -> RateLimitStatus.limited(reason, Math.max(1, Long.parseLong(until) - now.getEpochSecond())))
                .orElse(null);
    }

    static String key(String tenantId, String customerKey, String type) {
        return "rate_limit:" + tenantId + ":" + customerKey + ":" + type;
    }
}
