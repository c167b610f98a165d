package com.ai.commerce.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained classification of what the customer wants in one turn.
 */
public enum Intent {
    SALES_DISCOVERY("sales_discovery"),
    PRODUCT_QUESTION("product_question"),
    SUPPORT_QUESTION("support_question"),
    ORDER_STATUS("order_status"),
    DISCOUNTS_OFFERS("discounts_offers"),
    PREFERENCES_CONSENT("preferences_consent"),
    PAYMENT_HELP("payment_help"),
    HUMAN_REQUEST("human_request"),
    SPAM_CASUAL("spam_casual"),
    UNKNOWN("unknown");

    private final String value;

    Intent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Intents that signal commercial interest, used by the governance heuristic. */
    public boolean isBusiness() {
        return this != HUMAN_REQUEST && this != SPAM_CASUAL && this != UNKNOWN;
    }

    @JsonCreator
    public static Intent fromValue(String value) {
        for (Intent candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown Intent: " + value);
    }
}
