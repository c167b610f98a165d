package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.GovernanceAction;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import com.ai.commerce.exception.InvalidStateException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Casual/spam/abuse turn counting and chattiness policy. Business turns pass through untouched;
 * every other outcome redirects the turn to the governance journey.
 */
@Service
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    public static final int SPAM_TURN_LIMIT = 2;
    public static final String ABUSE_ESCALATION_REASON = "Abusive content detected";

    private final RateLimiter rateLimiter;

    public GovernanceEngine(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    /** Casual turns tolerated per chattiness level: 0, 1, 2 and 4. */
    public static int maxCasualTurns(int chattinessLevel) {
        switch (chattinessLevel) {
            case 0:
                return 0;
            case 1:
                return 1;
            case 2:
                return 2;
            case 3:
                return 4;
            default:
                throw new InvalidStateException("max_chattiness_level", "must be between 0 and 3, got " + chattinessLevel);
        }
    }

    /** Action for a casual turn once the counter includes that turn. */
    public static GovernanceAction casualAction(int casualTurns, int chattinessLevel) {
        return casualTurns > maxCasualTurns(chattinessLevel)
                ? GovernanceAction.REDIRECT_TO_BUSINESS
                : GovernanceAction.FRIENDLY_CASUAL_RESPONSE;
    }

    /** Action for a spam turn once the counter includes that turn. */
    public static GovernanceAction spamAction(int spamTurns) {
        return spamTurns >= SPAM_TURN_LIMIT ? GovernanceAction.DISENGAGE : GovernanceAction.SPAM_WARNING;
    }

    /**
     * Applies governance policy for the current turn. The rate limiter is consulted first and a
     * throttled customer short-circuits regardless of classification.
     *
     * @return the governance redirect, or empty when the turn proceeds to normal routing
     */
    public Optional<RouteDecision> evaluate(ConversationState state, GovernanceResult result) {
        String customerKey = customerKey(state);
        if (customerKey != null) {
            RateLimitStatus status = rateLimiter.checkRateLimit(state.getTenantId(), customerKey);
            if (!status.isAllowed()) {
                log.info("[{}] rate limited: {}", state.getConversationId(), status.getReason());
                return Optional.of(rateLimited(status));
            }
        }

        switch (result.getClassification()) {
            case CASUAL:
                return Optional.of(casual(state, result));
            case SPAM:
                return Optional.of(spam(state, result, customerKey));
            case ABUSE:
                return Optional.of(abuse(state, result, customerKey));
            case BUSINESS:
            default:
                return Optional.empty();
        }
    }

    private RouteDecision casual(ConversationState state, GovernanceResult result) {
        state.incrementCasualTurns();
        int level = state.getMaxChattinessLevel();
        GovernanceAction action = casualAction(state.getCasualTurns(), level);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.GOVERNANCE_ACTION, action.getValue());
        metadata.put(RouteDecision.CASUAL_TURNS, state.getCasualTurns());
        metadata.put(RouteDecision.MAX_ALLOWED, maxCasualTurns(level));
        metadata.put(RouteDecision.CHATTINESS_LEVEL, level);

        String reason = action == GovernanceAction.REDIRECT_TO_BUSINESS
                ? "Casual turn limit exceeded (" + state.getCasualTurns() + " > " + maxCasualTurns(level) + ")"
                : "Casual conversation within limits";
        return RouteDecision.of(Journey.GOVERNANCE, reason, result.getConfidence(), false, metadata);
    }

    private RouteDecision spam(ConversationState state, GovernanceResult result, String customerKey) {
        state.incrementSpamTurns();
        GovernanceAction action = spamAction(state.getSpamTurns());
        if (action == GovernanceAction.DISENGAGE && customerKey != null) {
            rateLimiter.applySpamCooldown(state.getTenantId(), customerKey);
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.GOVERNANCE_ACTION, action.getValue());
        metadata.put(RouteDecision.SPAM_TURNS, state.getSpamTurns());
        metadata.put(RouteDecision.MAX_ALLOWED, SPAM_TURN_LIMIT);
        String reason = action == GovernanceAction.DISENGAGE ? "Repeated spam, disengaging" : "Spam detected";
        return RouteDecision.of(Journey.GOVERNANCE, reason, result.getConfidence(), false, metadata);
    }

    private RouteDecision abuse(ConversationState state, GovernanceResult result, String customerKey) {
        if (customerKey != null) {
            rateLimiter.applyAbuseCooldown(state.getTenantId(), customerKey);
        }
        log.warn("[{}] abusive content, stopping conversation", state.getConversationId());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.GOVERNANCE_ACTION, GovernanceAction.ABUSE_STOP.getValue());
        metadata.put(RouteDecision.ESCALATION_REQUIRED, true);
        metadata.put(RouteDecision.ESCALATION_REASON, ABUSE_ESCALATION_REASON);
        return RouteDecision.of(Journey.GOVERNANCE, ABUSE_ESCALATION_REASON, result.getConfidence(), false, metadata);
    }

    private RouteDecision rateLimited(RateLimitStatus status) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.GOVERNANCE_ACTION, GovernanceAction.RATE_LIMITED.getValue());
        metadata.put(RouteDecision.RATE_LIMIT_REASON, status.getReason());
        metadata.put(RouteDecision.RETRY_AFTER_SECONDS, status.getRetryAfterSeconds());
        metadata.put(RouteDecision.ESCALATION_REQUIRED, true);
        metadata.put(RouteDecision.ESCALATION_REASON, "Rate limited: " + status.getReason());
        return RouteDecision.of(Journey.GOVERNANCE, "Rate limited: " + status.getReason(), 1.0, false, metadata);
    }

    static String customerKey(ConversationState state) {
        if (StringUtils.isNotBlank(state.getCustomerId())) {
            return state.getCustomerId();
        }
        return StringUtils.isNotBlank(state.getPhone()) ? state.getPhone() : null;
    }
}
