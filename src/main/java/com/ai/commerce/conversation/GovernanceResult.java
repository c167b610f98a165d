package com.ai.commerce.conversation;

import com.ai.commerce.exception.InvalidStateException;

/**
 * Business/casual/spam/abuse tag for one message plus the classifier's recommended action.
 */
public final class GovernanceResult {

    private final GovernorClassification classification;
    private final double confidence;
    private final RecommendedAction recommendedAction;

    public GovernanceResult(GovernorClassification classification, double confidence, RecommendedAction recommendedAction) {
        if (classification == null) {
            throw new InvalidStateException("classification", "must not be null");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new InvalidStateException("confidence", "must be within [0, 1], got " + confidence);
        }
        this.classification = classification;
        this.confidence = confidence;
        this.recommendedAction = recommendedAction != null ? recommendedAction : defaultActionFor(classification);
    }

    public static GovernanceResult of(GovernorClassification classification, double confidence) {
        return new GovernanceResult(classification, confidence, defaultActionFor(classification));
    }

    /** Unknown classifications are treated as business so that traffic is never dropped on a bad label. */
    public static GovernanceResult sanitized(String rawClassification, double rawConfidence, String rawAction) {
        GovernorClassification classification;
        double confidence = IntentResult.clamp(rawConfidence);
        try {
            classification = GovernorClassification.fromValue(rawClassification);
        } catch (IllegalArgumentException e) {
            classification = GovernorClassification.BUSINESS;
            confidence = 0.0;
        }
        RecommendedAction action;
        try {
            action = RecommendedAction.fromValue(rawAction);
        } catch (IllegalArgumentException e) {
            action = defaultActionFor(classification);
        }
        return new GovernanceResult(classification, confidence, action);
    }

    static RecommendedAction defaultActionFor(GovernorClassification classification) {
        switch (classification) {
            case CASUAL:
                return RecommendedAction.REDIRECT;
            case SPAM:
                return RecommendedAction.LIMIT;
            case ABUSE:
                return RecommendedAction.STOP;
            case BUSINESS:
            default:
                return RecommendedAction.PROCEED;
        }
    }

    public GovernorClassification getClassification() {
        return classification;
    }

    public double getConfidence() {
        return confidence;
    }

    public RecommendedAction getRecommendedAction() {
        return recommendedAction;
    }

    @Override
    public String toString() {
        return "GovernanceResult{" + classification.getValue() + ", confidence=" + confidence
                + ", action=" + recommendedAction.getValue() + "}";
    }
}
