package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the governance stage decided for the turn.
 */
public enum GovernanceAction {
    REDIRECT_TO_BUSINESS("redirect_to_business"),
    FRIENDLY_CASUAL_RESPONSE("friendly_casual_response"),
    SPAM_WARNING("spam_warning"),
    DISENGAGE("disengage"),
    ABUSE_STOP("abuse_stop"),
    RATE_LIMITED("rate_limited"),
    PROCEED_TO_JOURNEY("proceed_to_journey");

    private final String value;

    GovernanceAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GovernanceAction fromValue(String value) {
        for (GovernanceAction candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown GovernanceAction: " + value);
    }
}
