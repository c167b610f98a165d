package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.GovernorClassification;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Keyword business/casual/spam/abuse tagging. Abuse is checked first, then spam shapes, then business
 * vocabulary; unclear messages get the benefit of the doubt and count as business.
 */
@Service
public class KeywordGovernanceClassifier {

    public static final double BUSINESS_INTENT_MIN_CONFIDENCE = 0.5;

    private static final Pattern ABUSE = Pattern.compile(
            "\\b(fuck|shit|damn|bitch|ass|hell|bastard|stupid|idiot|moron|dumb|hate|kill|die)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SPAM_WORDS = Pattern.compile(
            "\\b(test|testing|123|asdf|qwerty|random|zzz+)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern BUSINESS = Pattern.compile(
            "\\b(buy|purchase|shop|products?|items?|catalog|price|cost|available|stock|show me|looking for|want|need"
                    + "|orders?|delivery|tracking|status|shipped|delivered"
                    + "|help|support|problem|issue|broken|not working|error|question|how to|can you|unable"
                    + "|payment|pay|paid|transaction|refund|charge|billing|mpesa|card|checkout"
                    + "|discount|coupon|offer|deal|promo|sale|cheap"
                    + "|language|unsubscribe|stop|opt out|preferences|settings)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern CASUAL = Pattern.compile(
            "\\b(hello|hi|hey|good morning|good afternoon|good evening|how are you|what'?s up|wassup|sup"
                    + "|thanks|thank you|bye|goodbye|see you|nice|cool|great|awesome|lol|haha)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern QUESTION_WORD = Pattern.compile(
            "\\b(what|where|when|how|why|who|which)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public GovernanceResult classify(String message, ConversationState state, double confidence) {
        return GovernanceResult.of(classification(message, state), confidence);
    }

    GovernorClassification classification(String message, ConversationState state) {
        if (StringUtils.isBlank(message)) {
            return GovernorClassification.SPAM;
        }
        String t = message.trim();
        if (ABUSE.matcher(t).find()) {
            return GovernorClassification.ABUSE;
        }
        if (t.length() < 3) {
            return GovernorClassification.SPAM;
        }
        if (t.chars().distinct().count() <= 2 && t.length() > 3) {
            return GovernorClassification.SPAM;
        }
        if (SPAM_WORDS.matcher(t).find()) {
            return GovernorClassification.SPAM;
        }
        long alphanumeric = t.chars().filter(Character::isLetterOrDigit).count();
        if (alphanumeric < t.length() * 0.5) {
            return GovernorClassification.SPAM;
        }
        if (BUSINESS.matcher(t).find()) {
            return GovernorClassification.BUSINESS;
        }
        if (state != null && state.getIntent().isBusiness()
                && state.getIntentConfidence() >= BUSINESS_INTENT_MIN_CONFIDENCE) {
            return GovernorClassification.BUSINESS;
        }
        if (CASUAL.matcher(t).find()) {
            return GovernorClassification.CASUAL;
        }
        boolean question = QUESTION_WORD.matcher(t).find() || t.contains("?");
        if (question && t.split("\\s+").length <= 5) {
            return GovernorClassification.CASUAL;
        }
        return GovernorClassification.BUSINESS;
    }
}
