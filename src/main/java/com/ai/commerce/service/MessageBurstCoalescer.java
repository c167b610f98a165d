package com.ai.commerce.service;

import com.ai.commerce.dto.InboundMessage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Holds back rapid successive messages of one conversation so they are answered as a single turn.
 * A message arriving within the window of the previous one is queued; the batch drains once the
 * conversation has been quiet for a full window.
 */
@Service
public class MessageBurstCoalescer {

    private static final Logger log = LoggerFactory.getLogger(MessageBurstCoalescer.class);

    public enum Decision {
        PROCESS_NOW,
        QUEUED
    }

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration window;
    private final int maxBuffer;
    private final ConcurrentHashMap<String, Burst> bursts = new ConcurrentHashMap<>();
    private volatile Consumer<InboundMessage> batchHandler = batch ->
            log.warn("[{}] no batch handler registered, dropping {} chars", batch.conversationKey(),
                    StringUtils.length(batch.getMessageText()));

    public MessageBurstCoalescer(@Qualifier("burstScheduler") ScheduledExecutorService scheduler,
                                 Clock clock,
                                 @Value("${orchestrator.burst.window-seconds:5}") long windowSeconds,
                                 @Value("${orchestrator.burst.max-buffer:10}") int maxBuffer) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.window = Duration.ofSeconds(windowSeconds);
        this.maxBuffer = maxBuffer;
        scheduler.scheduleWithFixedDelay(this::evictIdle, 1, 1, TimeUnit.MINUTES);
    }

    public void onBatch(Consumer<InboundMessage> handler) {
        this.batchHandler = handler;
    }

    public Decision offer(InboundMessage message) {
        String key = message.conversationKey();
        while (true) {
            Burst burst = bursts.computeIfAbsent(key, k -> new Burst());
            InboundMessage overflow;
            synchronized (burst) {
                if (burst.retired) {
                    continue;
                }
                Instant now = clock.instant();
                Instant previous = burst.lastInboundAt;
                burst.lastInboundAt = now;
                boolean withinWindow = previous != null && Duration.between(previous, now).compareTo(window) <= 0;
                if (!withinWindow && burst.queue.isEmpty()) {
                    return Decision.PROCESS_NOW;
                }
                burst.queue.addLast(message);
                if (burst.queue.size() < maxBuffer) {
                    if (burst.pending == null) {
                        burst.pending = scheduler.schedule(() -> flush(key, burst), window.toMillis(), TimeUnit.MILLISECONDS);
                    }
                    log.debug("[{}] queued message {} ({} waiting)", key, message.getMessageId(), burst.queue.size());
                    return Decision.QUEUED;
                }
                if (burst.pending != null) {
                    burst.pending.cancel(false);
                    burst.pending = null;
                }
                overflow = combine(burst.drain());
                log.info("[{}] burst buffer full, draining {} messages now", key, maxBuffer);
            }
            dispatch(overflow);
            return Decision.QUEUED;
        }
    }

    /** Drains the queue if the conversation has been quiet for a full window, otherwise waits the remainder. */
    void flush(String key, Burst burst) {
        InboundMessage batch;
        synchronized (burst) {
            burst.pending = null;
            if (burst.retired || burst.queue.isEmpty()) {
                return;
            }
            Duration quiet = Duration.between(burst.lastInboundAt, clock.instant());
            if (quiet.compareTo(window) < 0) {
                burst.pending = scheduler.schedule(() -> flush(key, burst),
                        window.minus(quiet).toMillis(), TimeUnit.MILLISECONDS);
                return;
            }
            batch = combine(burst.drain());
        }
        log.info("[{}] draining burst as one turn", key);
        dispatch(batch);
    }

    int waiting(String conversationKey) {
        Burst burst = bursts.get(conversationKey);
        if (burst == null) {
            return 0;
        }
        synchronized (burst) {
            return burst.queue.size();
        }
    }

    void evictIdle() {
        Instant now = clock.instant();
        bursts.forEach((key, burst) -> {
            synchronized (burst) {
                boolean idle = burst.queue.isEmpty() && burst.pending == null
                        && (burst.lastInboundAt == null || Duration.between(burst.lastInboundAt, now).compareTo(window) > 0);
                if (idle) {
                    burst.retired = true;
                    bursts.remove(key, burst);
                }
            }
        });
    }

    private void dispatch(InboundMessage batch) {
        try {
            batchHandler.accept(batch);
        } catch (RuntimeException e) {
            log.error("[{}] batch handler failed", batch.conversationKey(), e);
        }
    }

    /** Merges queued messages, in arrival order, into one message carrying the latest ids. */
    static InboundMessage combine(List<InboundMessage> messages) {
        InboundMessage last = messages.get(messages.size() - 1);
        String text = messages.stream()
                .map(InboundMessage::getMessageText)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining("\n"));
        String phone = null;
        String customerId = null;
        for (InboundMessage m : messages) {
            if (m.getPhone() != null) phone = m.getPhone();
            if (m.getCustomerId() != null) customerId = m.getCustomerId();
        }
        return last.toBuilder()
                .messageText(text)
                .phone(phone)
                .customerId(customerId)
                .coalescedFrom(List.copyOf(messages))
                .build();
    }

    static final class Burst {
        private final Deque<InboundMessage> queue = new ArrayDeque<>();
        private Instant lastInboundAt;
        private ScheduledFuture<?> pending;
        private boolean retired;

        private List<InboundMessage> drain() {
            List<InboundMessage> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        }
    }
}
