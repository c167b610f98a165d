package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.conversation.ResponseLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the reply language. A stored customer preference wins; otherwise the detected language is
 * used only when it is confident and allowed for the tenant, else the tenant default.
 */
@Service
public class LanguagePolicy {

    private static final Logger log = LoggerFactory.getLogger(LanguagePolicy.class);

    public static final double SWITCH_THRESHOLD = 0.75;

    public ResponseLanguage choose(ConversationState state, LanguageResult detected) {
        ResponseLanguage preference = state.getCustomerLanguagePref();
        if (preference != null && state.isLanguageAllowed(preference)) {
            return preference;
        }
        if (detected.getConfidence() >= SWITCH_THRESHOLD && state.isLanguageAllowed(detected.getResponseLanguage())) {
            return detected.getResponseLanguage();
        }
        log.debug("[{}] keeping default language {} (detected {} at {})", state.getConversationId(),
                state.getDefaultLanguage().getValue(), detected.getResponseLanguage().getValue(), detected.getConfidence());
        return state.getDefaultLanguage();
    }

    public ConversationState apply(ConversationState state, LanguageResult detected) {
        state.updateLanguage(choose(state, detected), detected.getConfidence());
        return state;
    }
}
