package com.ai.commerce.store;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-bounded mutual exclusion shared across workers. Expiry releases locks whose owner crashed.
 */
public interface DistributedLock {

    boolean tryAcquire(String key, String ownerToken, Duration ttl);

    /** Releases the lock only while {@code ownerToken} still owns it. */
    boolean release(String key, String ownerToken);

    boolean isHeld(String key);

    Optional<String> currentOwnerToken(String key);

    /** Releases the lock regardless of owner. Operator use only. */
    boolean forceRelease(String key);
}
