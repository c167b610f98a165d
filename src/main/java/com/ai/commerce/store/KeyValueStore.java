package com.ai.commerce.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value store for locks, processing state and rate-limit counters.
 * Every mutation is atomic on the store side; callers never read-modify-write.
 */
public interface KeyValueStore {

    /** Stores the value only if the key is absent. Returns true when this call created the key. */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean delete(String key);

    /** Deletes the key only while it still holds {@code expectedValue}. */
    boolean compareAndDelete(String key, String expectedValue);

    /** Atomically increments a counter; the TTL is applied when the counter is created. */
    long increment(String key, Duration ttl);
}
