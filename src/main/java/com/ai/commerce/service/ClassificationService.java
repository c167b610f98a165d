package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.IntentResult;
import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.exception.ClassifierFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Model-first classification with keyword fallbacks, so a turn never blocks on the classifier.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    static final double MALFORMED_REPLY_CONFIDENCE = 0.6;
    static final double UNAVAILABLE_CONFIDENCE = 0.5;

    private final LlmClassifierClient llmClient;
    private final KeywordIntentClassifier intentFallback;
    private final KeywordLanguageClassifier languageFallback;
    private final KeywordGovernanceClassifier governanceFallback;

    public ClassificationService(LlmClassifierClient llmClient,
                                 KeywordIntentClassifier intentFallback,
                                 KeywordLanguageClassifier languageFallback,
                                 KeywordGovernanceClassifier governanceFallback) {
        this.llmClient = llmClient;
        this.intentFallback = intentFallback;
        this.languageFallback = languageFallback;
        this.governanceFallback = governanceFallback;
    }

    public IntentResult classifyIntent(ConversationState state) {
        String message = state.getIncomingMessage();
        try {
            return llmClient.classifyIntent(message, state);
        } catch (ClassifierFailureException e) {
            logFallback(state, "intent", e);
            return intentFallback.classify(message, fallbackConfidence(e));
        }
    }

    public LanguageResult classifyLanguage(ConversationState state) {
        String message = state.getIncomingMessage();
        try {
            return llmClient.classifyLanguage(message, state);
        } catch (ClassifierFailureException e) {
            logFallback(state, "language", e);
            return languageFallback.classify(message, fallbackConfidence(e));
        }
    }

    public GovernanceResult classifyGovernance(ConversationState state) {
        String message = state.getIncomingMessage();
        try {
            return llmClient.classifyGovernance(message, state);
        } catch (ClassifierFailureException e) {
            logFallback(state, "governance", e);
            return governanceFallback.classify(message, state, fallbackConfidence(e));
        }
    }

    private static double fallbackConfidence(ClassifierFailureException e) {
        return e.isMalformedResponse() ? MALFORMED_REPLY_CONFIDENCE : UNAVAILABLE_CONFIDENCE;
    }

    private static void logFallback(ConversationState state, String classifier, ClassifierFailureException e) {
        log.warn("[{}] {} classifier unavailable, using keyword fallback: {}",
                state.getConversationId(), classifier, e.getMessage());
    }
}
