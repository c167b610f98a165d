package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseLanguage {
    EN("en"),
    SW("sw"),
    SHENG("sheng"),
    MIXED("mixed");

    private final String value;

    ResponseLanguage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResponseLanguage fromValue(String value) {
        for (ResponseLanguage candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ResponseLanguage: " + value);
    }
}
