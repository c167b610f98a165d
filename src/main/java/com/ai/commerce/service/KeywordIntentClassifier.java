package com.ai.commerce.service;

import com.ai.commerce.conversation.Intent;
import com.ai.commerce.conversation.IntentResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword intent classifier used when the model is unavailable. Rules are checked in order and the
 * first match wins, so human requests beat order questions, which beat payments, and so on.
 */
@Service
public class KeywordIntentClassifier {

    private static final Pattern HUMAN = Pattern.compile(
            "\\b(human|agent|person|call me|speak to someone|representative)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ORDER = Pattern.compile(
            "\\b(orders?|delivery|tracking|track|status|shipped|delivered)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PAYMENT = Pattern.compile(
            "\\b(payment|pay|paid|transaction|refund|charged?|billing|mpesa)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern DISCOUNTS = Pattern.compile(
            "\\b(discounts?|coupons?|offers?|deals?|promo|sale|cheap)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PREFERENCES = Pattern.compile(
            "\\b(language|unsubscribe|stop|opt out|preferences|settings)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SUPPORT = Pattern.compile(
            "\\b(help|support|problem|issue|broken|not working|error)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PRODUCT = Pattern.compile(
            "\\b(products?|items?|features?|specifications?|available|in stock|stock)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SALES = Pattern.compile(
            "\\b(buy|purchase|shop|catalog|what do you have|show me|looking for)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GREETING = Pattern.compile(
            "\\b(hello|hi|hey|how are you|good morning|good afternoon|thanks)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Map<Pattern, Intent> RULES = new LinkedHashMap<>();

    static {
        RULES.put(HUMAN, Intent.HUMAN_REQUEST);
        RULES.put(ORDER, Intent.ORDER_STATUS);
        RULES.put(PAYMENT, Intent.PAYMENT_HELP);
        RULES.put(DISCOUNTS, Intent.DISCOUNTS_OFFERS);
        RULES.put(PREFERENCES, Intent.PREFERENCES_CONSENT);
        RULES.put(SUPPORT, Intent.SUPPORT_QUESTION);
        RULES.put(PRODUCT, Intent.PRODUCT_QUESTION);
        RULES.put(SALES, Intent.SALES_DISCOVERY);
        RULES.put(GREETING, Intent.SPAM_CASUAL);
    }

    public IntentResult classify(String message, double confidence) {
        String t = StringUtils.trimToEmpty(message);
        for (Map.Entry<Pattern, Intent> rule : RULES.entrySet()) {
            if (rule.getKey().matcher(t).find()) {
                return IntentResult.of(rule.getValue(), confidence, "Keyword fallback: " + rule.getValue().getValue());
            }
        }
        if (t.length() < 3) {
            return IntentResult.of(Intent.SPAM_CASUAL, confidence, "Keyword fallback: very short message");
        }
        return IntentResult.of(Intent.UNKNOWN, confidence, "Keyword fallback: no match");
    }
}
