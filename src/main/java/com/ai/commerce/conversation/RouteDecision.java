package com.ai.commerce.conversation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Routing outcome for one turn. Produced by the intent router, the governance engine and the
 * escalation detector so that one structure drives every kind of routing.
 */
public final class RouteDecision {

    public static final String ROUTING_THRESHOLD = "routing_threshold";
    public static final String INTENT = "intent";
    public static final String SUGGESTED_JOURNEY = "suggested_journey";
    public static final String THRESHOLD_MET = "threshold_met";
    public static final String NEEDS_CLARIFICATION = "needs_clarification";
    public static final String CLARIFICATION_TYPE = "clarification_type";
    public static final String GOVERNANCE_ACTION = "governance_action";
    public static final String CASUAL_TURNS = "casual_turns";
    public static final String SPAM_TURNS = "spam_turns";
    public static final String MAX_ALLOWED = "max_allowed";
    public static final String CHATTINESS_LEVEL = "chattiness_level";
    public static final String ESCALATION_REQUIRED = "escalation_required";
    public static final String ESCALATION_TRIGGER = "escalation_trigger";
    public static final String ESCALATION_REASON = "escalation_reason";
    public static final String ESCALATION_PRIORITY = "escalation_priority";
    public static final String ESCALATION_CATEGORY = "escalation_category";
    public static final String RATE_LIMIT_REASON = "rate_limit_reason";
    public static final String RETRY_AFTER_SECONDS = "retry_after_seconds";

    private final Journey journey;
    private final String reason;
    private final double confidence;
    private final boolean shouldClarify;
    private final Map<String, Object> metadata;

    private RouteDecision(Journey journey, String reason, double confidence, boolean shouldClarify,
                          Map<String, Object> metadata) {
        this.journey = journey;
        this.reason = reason;
        this.confidence = confidence;
        this.shouldClarify = shouldClarify;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
    }

    public static RouteDecision of(Journey journey, String reason, double confidence, boolean shouldClarify,
                                   Map<String, Object> metadata) {
        return new RouteDecision(journey, reason, confidence, shouldClarify, metadata);
    }

    public Journey getJourney() {
        return journey;
    }

    public String getReason() {
        return reason;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isShouldClarify() {
        return shouldClarify;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getString(String key) {
        Object v = metadata.get(key);
        return v == null ? null : v.toString();
    }

    public boolean isEscalation() {
        return Boolean.TRUE.equals(metadata.get(ESCALATION_REQUIRED));
    }

    public EscalationTrigger getEscalationTrigger() {
        return EscalationTrigger.fromValue(getString(ESCALATION_TRIGGER));
    }

    public GovernanceAction getGovernanceAction() {
        String action = getString(GOVERNANCE_ACTION);
        return action == null ? null : GovernanceAction.fromValue(action);
    }

    @Override
    public String toString() {
        return "RouteDecision{journey=" + journey.getValue() + ", reason='" + reason + "', confidence=" + confidence
                + ", shouldClarify=" + shouldClarify + ", metadata=" + metadata + "}";
    }
}
