package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk/relevance tag used for cost and safety control.
 */
public enum GovernorClassification {
    BUSINESS("business"),
    CASUAL("casual"),
    SPAM("spam"),
    ABUSE("abuse");

    private final String value;

    GovernorClassification(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GovernorClassification fromValue(String value) {
        for (GovernorClassification candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown GovernorClassification: " + value);
    }
}
