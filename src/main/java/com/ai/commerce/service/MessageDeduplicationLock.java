package com.ai.commerce.service;

import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.dto.LockRecord;
import com.ai.commerce.dto.ProcessingState;
import com.ai.commerce.dto.ProcessingStatus;
import com.ai.commerce.exception.LockHeldException;
import com.ai.commerce.store.DistributedLock;
import com.ai.commerce.store.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Guarantees at most one active processing per inbound message. Each fingerprint owns a lock
 * (set-if-absent, short TTL) and a processing-state record (longer TTL) used to reject replays.
 */
@Service
public class MessageDeduplicationLock {

    private static final Logger log = LoggerFactory.getLogger(MessageDeduplicationLock.class);

    static final String LOCK_PREFIX = "message_lock:";
    static final String STATE_PREFIX = "message_state:";

    private final DistributedLock lock;
    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration lockTtl;
    private final Duration stateTtl;

    public MessageDeduplicationLock(DistributedLock lock,
                                    KeyValueStore store,
                                    ObjectMapper mapper,
                                    Clock clock,
                                    @Value("${orchestrator.lock.ttl-seconds:300}") long lockTtlSeconds,
                                    @Value("${orchestrator.lock.state-ttl-seconds:600}") long stateTtlSeconds) {
        this.lock = lock;
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.lockTtl = Duration.ofSeconds(lockTtlSeconds);
        this.stateTtl = Duration.ofSeconds(stateTtlSeconds);
    }

    public static String fingerprint(String conversationId, String messageId, String messageText) {
        String contentHash = sha256Hex(StringUtils.defaultString(messageText)).substring(0, 16);
        return conversationId + ":" + messageId + ":" + contentHash;
    }

    public String fingerprint(InboundMessage message) {
        return fingerprint(message.getConversationId(), message.getMessageId(), message.getMessageText());
    }

    /** True while another worker holds the lock or once the message completed. */
    public boolean isDuplicate(String fingerprint) {
        if (lock.isHeld(LOCK_PREFIX + fingerprint)) {
            return true;
        }
        return getProcessingState(fingerprint)
                .map(state -> state.getStatus() == ProcessingStatus.COMPLETED)
                .orElse(false);
    }

    /**
     * Marks a message as taken on arrival, before it is processed or queued. The marker is the
     * processing-state record itself, created only if absent; a failed earlier attempt may be
     * claimed again.
     *
     * @return false when the message is being processed, waiting in a burst, or already completed
     */
    public boolean claim(String fingerprint, String owner) {
        String key = STATE_PREFIX + fingerprint;
        String marker = write(state(ProcessingStatus.PROCESSING, owner, null));
        if (store.setIfAbsent(key, marker, stateTtl)) {
            return true;
        }
        if (lock.isHeld(LOCK_PREFIX + fingerprint)) {
            return false;
        }
        Optional<String> existing = store.get(key);
        if (existing.isPresent() && read(existing.get(), ProcessingState.class).getStatus() == ProcessingStatus.FAILED
                && store.compareAndDelete(key, existing.get())) {
            log.info("[{}] retrying after an earlier failure", fingerprint);
            return store.setIfAbsent(key, marker, stateTtl);
        }
        return false;
    }

    /**
     * @throws LockHeldException when another worker owns the fingerprint
     */
    public Lease acquireLock(String fingerprint, String workerId) {
        LockRecord record = LockRecord.builder()
                .fingerprint(fingerprint)
                .owner(workerId)
                .acquiredAt(clock.instant())
                .ttlSeconds(lockTtl.getSeconds())
                .build();
        String token = write(record);
        if (!lock.tryAcquire(LOCK_PREFIX + fingerprint, token, lockTtl)) {
            String owner = lock.currentOwnerToken(LOCK_PREFIX + fingerprint)
                    .map(this::ownerOf)
                    .orElse(null);
            throw new LockHeldException(fingerprint, owner);
        }
        saveState(fingerprint, ProcessingStatus.PROCESSING, workerId, null);
        log.debug("[{}] lock acquired by {}", fingerprint, workerId);
        return new Lease(record, token);
    }

    public boolean releaseLock(Lease lease) {
        return lock.release(LOCK_PREFIX + lease.getRecord().getFingerprint(), lease.token);
    }

    /**
     * Runs {@code work} while holding the message lock. The lock is released on every path and the
     * processing state ends as completed or failed.
     *
     * @throws LockHeldException when another worker owns the fingerprint
     */
    public <T> T processExclusively(String fingerprint, String workerId, Supplier<T> work) {
        return processExclusively(List.of(fingerprint), workerId, work);
    }

    /**
     * Runs a coalesced turn. The lock is taken on the first fingerprint; every fingerprint in the
     * batch ends as completed or failed together.
     *
     * @throws LockHeldException when another worker owns the first fingerprint
     */
    public <T> T processExclusively(List<String> fingerprints, String workerId, Supplier<T> work) {
        String lead = fingerprints.get(0);
        Lease lease = acquireLock(lead, workerId);
        try {
            T result = work.get();
            fingerprints.forEach(fp -> saveState(fp, ProcessingStatus.COMPLETED, workerId, null));
            return result;
        } catch (RuntimeException e) {
            fingerprints.forEach(fp -> saveState(fp, ProcessingStatus.FAILED, workerId, e.getMessage()));
            throw e;
        } finally {
            if (!releaseLock(lease)) {
                log.warn("[{}] lock expired or was taken over before release", lead);
            }
        }
    }

    public Optional<ProcessingState> getProcessingState(String fingerprint) {
        return store.get(STATE_PREFIX + fingerprint).map(json -> read(json, ProcessingState.class));
    }

    public boolean forceReleaseLock(String fingerprint) {
        boolean released = lock.forceRelease(LOCK_PREFIX + fingerprint);
        if (released) {
            log.warn("[{}] lock force-released", fingerprint);
        }
        return released;
    }

    private void saveState(String fingerprint, ProcessingStatus status, String workerId, String error) {
        store.set(STATE_PREFIX + fingerprint, write(state(status, workerId, error)), stateTtl);
    }

    private ProcessingState state(ProcessingStatus status, String owner, String error) {
        return ProcessingState.builder()
                .status(status)
                .owner(owner)
                .updatedAt(clock.instant())
                .error(error)
                .build();
    }

    private String ownerOf(String token) {
        return read(token, LockRecord.class).getOwner();
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " record", e);
        }
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** A held message lock. */
    public static final class Lease {
        private final LockRecord record;
        private final String token;

        private Lease(LockRecord record, String token) {
            this.record = record;
            this.token = token;
        }

        public LockRecord getRecord() {
            return record;
        }
    }
}
