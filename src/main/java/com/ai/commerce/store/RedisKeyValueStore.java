package com.ai.commerce.store;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed store shared by every worker. Conditional writes map to SET NX, counters to INCR,
 * and owner-checked deletes run as a Lua script so the check and delete are one step.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final RedisScript<Long> INCREMENT_WITH_TTL = new DefaultRedisScript<>(
            "local v = redis.call('incr', KEYS[1]) if v == 1 then redis.call('pexpire', KEYS[1], ARGV[1]) end return v",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        Long deleted = redisTemplate.execute(COMPARE_AND_DELETE, List.of(key), expectedValue);
        return deleted != null && deleted > 0;
    }

    @Override
    public long increment(String key, Duration ttl) {
        Long value = redisTemplate.execute(INCREMENT_WITH_TTL, List.of(key), Long.toString(ttl.toMillis()));
        return value != null ? value : 0L;
    }
}
