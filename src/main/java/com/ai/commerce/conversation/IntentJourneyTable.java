package com.ai.commerce.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static intent to journey mapping shared by the router and classifier sanitization.
 */
public final class IntentJourneyTable {

    private static final Map<Intent, Journey> TABLE;

    static {
        Map<Intent, Journey> m = new EnumMap<>(Intent.class);
        m.put(Intent.SALES_DISCOVERY, Journey.SALES);
        m.put(Intent.PRODUCT_QUESTION, Journey.SALES);
        m.put(Intent.SUPPORT_QUESTION, Journey.SUPPORT);
        m.put(Intent.ORDER_STATUS, Journey.ORDERS);
        m.put(Intent.DISCOUNTS_OFFERS, Journey.OFFERS);
        m.put(Intent.PREFERENCES_CONSENT, Journey.PREFS);
        m.put(Intent.PAYMENT_HELP, Journey.SUPPORT);
        m.put(Intent.HUMAN_REQUEST, Journey.GOVERNANCE);
        m.put(Intent.SPAM_CASUAL, Journey.GOVERNANCE);
        m.put(Intent.UNKNOWN, Journey.UNKNOWN);
        TABLE = Collections.unmodifiableMap(m);
    }

    private IntentJourneyTable() {
    }

    public static Journey journeyFor(Intent intent) {
        return intent == null ? Journey.UNKNOWN : TABLE.getOrDefault(intent, Journey.UNKNOWN);
    }

    public static Map<Intent, Journey> asMap() {
        return TABLE;
    }
}
