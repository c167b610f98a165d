package com.ai.commerce.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process store backed by a {@link ConcurrentHashMap}. Expired entries are treated as absent
 * and evicted lazily on access.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        AtomicBoolean created = new AtomicBoolean(false);
        Instant now = clock.instant();
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, now.plus(ttl));
        });
        return created.get();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        AtomicBoolean deleted = new AtomicBoolean(false);
        Instant now = clock.instant();
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.value.equals(expectedValue)) {
                deleted.set(true);
                return null;
            }
            return existing;
        });
        return deleted.get();
    }

    @Override
    public long increment(String key, Duration ttl) {
        Instant now = clock.instant();
        Entry updated = entries.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new Entry("1", now.plus(ttl));
            }
            long next = Long.parseLong(existing.value) + 1;
            return new Entry(Long.toString(next), existing.expiresAt);
        });
        return Long.parseLong(updated.value);
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
