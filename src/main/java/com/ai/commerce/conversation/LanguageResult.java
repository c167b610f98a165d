package com.ai.commerce.conversation;

import com.ai.commerce.exception.InvalidStateException;

public final class LanguageResult {

    private final ResponseLanguage responseLanguage;
    private final double confidence;
    private final boolean shouldAskLanguageQuestion;

    public LanguageResult(ResponseLanguage responseLanguage, double confidence, boolean shouldAskLanguageQuestion) {
        if (responseLanguage == null) {
            throw new InvalidStateException("response_language", "must not be null");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new InvalidStateException("confidence", "must be within [0, 1], got " + confidence);
        }
        this.responseLanguage = responseLanguage;
        this.confidence = confidence;
        this.shouldAskLanguageQuestion = shouldAskLanguageQuestion;
    }

    /** Unknown language codes fall back to English with zero confidence. */
    public static LanguageResult sanitized(String rawLanguage, double rawConfidence, boolean shouldAsk) {
        try {
            return new LanguageResult(ResponseLanguage.fromValue(rawLanguage), IntentResult.clamp(rawConfidence), shouldAsk);
        } catch (IllegalArgumentException e) {
            return new LanguageResult(ResponseLanguage.EN, 0.0, shouldAsk);
        }
    }

    public ResponseLanguage getResponseLanguage() {
        return responseLanguage;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isShouldAskLanguageQuestion() {
        return shouldAskLanguageQuestion;
    }

    @Override
    public String toString() {
        return "LanguageResult{" + responseLanguage.getValue() + ", confidence=" + confidence + "}";
    }
}
