package com.ai.commerce.store;

import java.time.Duration;
import java.util.Optional;

public class StoreBackedDistributedLock implements DistributedLock {

    private final KeyValueStore store;

    public StoreBackedDistributedLock(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public boolean tryAcquire(String key, String ownerToken, Duration ttl) {
        return store.setIfAbsent(key, ownerToken, ttl);
    }

    @Override
    public boolean release(String key, String ownerToken) {
        return store.compareAndDelete(key, ownerToken);
    }

    @Override
    public boolean isHeld(String key) {
        return store.get(key).isPresent();
    }

    @Override
    public Optional<String> currentOwnerToken(String key) {
        return store.get(key);
    }

    @Override
    public boolean forceRelease(String key) {
        return store.delete(key);
    }
}
