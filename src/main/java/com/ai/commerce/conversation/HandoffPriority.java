package com.ai.commerce.conversation;

import java.time.Duration;

public enum HandoffPriority {
    URGENT(Duration.ofMinutes(15), "within 15 minutes"),
    HIGH(Duration.ofHours(1), "within 1 hour"),
    MEDIUM(Duration.ofHours(4), "within 4 hours"),
    LOW(Duration.ofHours(24), "within 24 hours");

    private final Duration expectedResponse;
    private final String displayText;

    HandoffPriority(Duration expectedResponse, String displayText) {
        this.expectedResponse = expectedResponse;
        this.displayText = displayText;
    }

    public Duration getExpectedResponse() {
        return expectedResponse;
    }

    public String getDisplayText() {
        return displayText;
    }
}
