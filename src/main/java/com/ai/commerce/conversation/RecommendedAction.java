package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendedAction {
    PROCEED("proceed"),
    REDIRECT("redirect"),
    LIMIT("limit"),
    STOP("stop"),
    HANDOFF("handoff");

    private final String value;

    RecommendedAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RecommendedAction fromValue(String value) {
        for (RecommendedAction candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RecommendedAction: " + value);
    }
}
