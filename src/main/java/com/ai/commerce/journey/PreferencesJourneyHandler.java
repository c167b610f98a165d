package com.ai.commerce.journey;

import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.ResponseLanguage;
import com.ai.commerce.service.KeywordLanguageClassifier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Language and marketing consent changes requested in chat.
 */
@Component
public class PreferencesJourneyHandler implements JourneyHandler {

    private static final Logger log = LoggerFactory.getLogger(PreferencesJourneyHandler.class);

    private static final Pattern OPT_OUT = Pattern.compile(
            "\\b(stop|unsubscribe|opt out|opt-out|no more (messages|promotions|offers))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern OPT_IN = Pattern.compile(
            "\\b(subscribe|opt in|opt-in|send me (offers|promotions|updates))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final KeywordLanguageClassifier languageClassifier;
    private final ResponsePhrases phrases;

    public PreferencesJourneyHandler(KeywordLanguageClassifier languageClassifier, ResponsePhrases phrases) {
        this.languageClassifier = languageClassifier;
        this.phrases = phrases;
    }

    @Override
    public Set<Journey> journeys() {
        return EnumSet.of(Journey.PREFS);
    }

    @Override
    public ConversationState handle(ConversationState state) {
        String message = StringUtils.defaultString(state.getIncomingMessage());

        ResponseLanguage requested = languageClassifier.explicitRequest(message);
        if (requested != null && state.isLanguageAllowed(requested)) {
            state.setCustomerLanguagePref(requested);
            state.updateLanguage(requested, 1.0);
            log.info("[{}] language preference set to {}", state.getConversationId(), requested.getValue());
            state.setResponseText(phrases.languageUpdated(requested.getValue()));
            return state;
        }
        // opt-out first: "unsubscribe" also contains "subscribe"
        if (OPT_OUT.matcher(message).find()) {
            state.setMarketingOptIn(false);
            state.setResponseText(phrases.marketingOptOut());
            return state;
        }
        if (OPT_IN.matcher(message).find()) {
            state.setMarketingOptIn(true);
            state.setResponseText(phrases.marketingOptIn());
            return state;
        }
        state.setResponseText(phrases.preferencesMenu());
        return state;
    }
}
