package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * High-level conversation track a turn is routed to.
 */
public enum Journey {
    SALES("sales"),
    SUPPORT("support"),
    ORDERS("orders"),
    OFFERS("offers"),
    PREFS("prefs"),
    GOVERNANCE("governance"),
    UNKNOWN("unknown");

    private final String value;

    Journey(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Journey fromValue(String value) {
        for (Journey candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown Journey: " + value);
    }
}
