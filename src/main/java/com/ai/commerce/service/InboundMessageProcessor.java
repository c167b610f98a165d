package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.InboundAck;
import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.exception.LockHeldException;
import com.ai.commerce.journey.JourneyOrchestrator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Worker façade in front of the orchestrator: rejects duplicates, coalesces bursts and runs each
 * turn on the worker pool under the message lock.
 */
@Service
public class InboundMessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageProcessor.class);

    private final MessageDeduplicationLock deduplicationLock;
    private final MessageBurstCoalescer burstCoalescer;
    private final JourneyOrchestrator orchestrator;
    private final ReplyDispatcher replyDispatcher;
    private final TaskExecutor executor;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public InboundMessageProcessor(MessageDeduplicationLock deduplicationLock,
                                   MessageBurstCoalescer burstCoalescer,
                                   JourneyOrchestrator orchestrator,
                                   ReplyDispatcher replyDispatcher,
                                   @Qualifier("orchestratorExecutor") TaskExecutor executor) {
        this.deduplicationLock = deduplicationLock;
        this.burstCoalescer = burstCoalescer;
        this.orchestrator = orchestrator;
        this.replyDispatcher = replyDispatcher;
        this.executor = executor;
    }

    @PostConstruct
    void registerBatchHandler() {
        burstCoalescer.onBatch(this::submit);
    }

    public InboundAck accept(InboundMessage message) {
        String fingerprint = deduplicationLock.fingerprint(message);
        if (!deduplicationLock.claim(fingerprint, workerId)) {
            log.info("[{}] duplicate message {} ignored", message.conversationKey(), message.getMessageId());
            return new InboundAck(InboundAck.Status.DUPLICATE, fingerprint);
        }
        if (burstCoalescer.offer(message) == MessageBurstCoalescer.Decision.QUEUED) {
            return new InboundAck(InboundAck.Status.QUEUED, fingerprint);
        }
        submit(message);
        return new InboundAck(InboundAck.Status.ACCEPTED, fingerprint);
    }

    private void submit(InboundMessage message) {
        executor.execute(() -> process(message));
    }

    /**
     * Runs one turn under the message lock; a lock held elsewhere means another worker has it.
     * A coalesced turn records its outcome under each source message's fingerprint.
     */
    void process(InboundMessage message) {
        List<String> fingerprints = message.sourceMessages().stream()
                .map(deduplicationLock::fingerprint)
                .collect(Collectors.toList());
        try {
            ConversationState state = deduplicationLock.processExclusively(fingerprints, workerId,
                    () -> orchestrator.process(message, null));
            replyDispatcher.dispatch(message, state);
        } catch (LockHeldException e) {
            log.info("[{}] {} already being processed by {}, skipping", message.conversationKey(),
                    message.getMessageId(), e.getOwner());
        } catch (RuntimeException e) {
            log.error("[{}] processing of {} failed", message.conversationKey(), message.getMessageId(), e);
        }
    }
}
