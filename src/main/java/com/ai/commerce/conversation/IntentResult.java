package com.ai.commerce.conversation;

import com.ai.commerce.exception.InvalidStateException;
import org.apache.commons.lang3.StringUtils;

/**
 * Intent classification for one message. Instances always hold a confidence in [0, 1] and a
 * suggested journey consistent with the intent table.
 */
public final class IntentResult {

    public static final int MAX_NOTES_LENGTH = 100;

    private final Intent intent;
    private final double confidence;
    private final String notes;
    private final Journey suggestedJourney;

    public IntentResult(Intent intent, double confidence, String notes, Journey suggestedJourney) {
        if (intent == null) {
            throw new InvalidStateException("intent", "must not be null");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new InvalidStateException("confidence", "must be within [0, 1], got " + confidence);
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidStateException("notes", "must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        this.intent = intent;
        this.confidence = confidence;
        this.notes = notes;
        this.suggestedJourney = suggestedJourney != null ? suggestedJourney : Journey.UNKNOWN;
    }

    /**
     * Builds a result from loosely-typed classifier output: unknown intents become {@code unknown}
     * with confidence 0, confidence is clamped and notes are truncated.
     */
    public static IntentResult sanitized(String rawIntent, double rawConfidence, String rawNotes) {
        Intent intent;
        double confidence = clamp(rawConfidence);
        try {
            intent = Intent.fromValue(StringUtils.trimToEmpty(rawIntent));
        } catch (IllegalArgumentException e) {
            intent = Intent.UNKNOWN;
            confidence = 0.0;
        }
        return of(intent, confidence, StringUtils.truncate(rawNotes, MAX_NOTES_LENGTH));
    }

    public static IntentResult of(Intent intent, double confidence, String notes) {
        return new IntentResult(intent, confidence, notes, IntentJourneyTable.journeyFor(intent));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public Intent getIntent() {
        return intent;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getNotes() {
        return notes;
    }

    public Journey getSuggestedJourney() {
        return suggestedJourney;
    }

    @Override
    public String toString() {
        return "IntentResult{" + intent.getValue() + ", confidence=" + confidence + ", notes='" + notes + "'}";
    }
}
