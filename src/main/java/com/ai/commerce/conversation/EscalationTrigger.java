package com.ai.commerce.conversation;

/**
 * Rule-matched conditions that force a human handoff, with the handoff category and priority each one opens.
 */
public enum EscalationTrigger {
    STATE_FLAGGED("state_flagged", 1.0, "general", HandoffPriority.MEDIUM),
    EXPLICIT_HUMAN_REQUEST("explicit_human_request", 1.0, "human_request", HandoffPriority.HIGH),
    PAYMENT_DISPUTE("payment_dispute", 0.9, "payment_dispute", HandoffPriority.HIGH),
    SENSITIVE_CONTENT("sensitive_content", 0.8, "sensitive_content", HandoffPriority.URGENT),
    USER_FRUSTRATION("user_frustration", 0.7, "user_frustration", HandoffPriority.MEDIUM),
    REPEATED_FAILURES("repeated_failures", 0.9, "technical_issue", HandoffPriority.MEDIUM);

    private final String value;
    private final double confidence;
    private final String category;
    private final HandoffPriority priority;

    EscalationTrigger(String value, double confidence, String category, HandoffPriority priority) {
        this.value = value;
        this.confidence = confidence;
        this.category = category;
        this.priority = priority;
    }

    public String getValue() {
        return value;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getCategory() {
        return category;
    }

    public HandoffPriority getPriority() {
        return priority;
    }

    public static EscalationTrigger fromValue(String value) {
        for (EscalationTrigger trigger : values()) {
            if (trigger.value.equals(value)) {
                return trigger;
            }
        }
        return null;
    }
}
