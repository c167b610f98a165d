package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.conversation.ResponseLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LanguagePolicy")
class LanguagePolicyTest {

    private final LanguagePolicy policy = new LanguagePolicy();
    private ConversationState state;

    @BeforeEach
    void setUp() {
        state = ConversationState.createInitial("tenant-1", "conv-1", "req-1");
    }

    @Test
    @DisplayName("Switches at 0.75 when the language is allowed")
    void testSwitchThreshold() {
        assertEquals(ResponseLanguage.SW, policy.choose(state, new LanguageResult(ResponseLanguage.SW, 0.75, false)));
        assertEquals(ResponseLanguage.EN, policy.choose(state, new LanguageResult(ResponseLanguage.SW, 0.74, false)));
    }

    @Test
    @DisplayName("Disallowed languages fall back to the tenant default")
    void testDisallowed() {
        state.setAllowedLanguages(List.of(ResponseLanguage.EN, ResponseLanguage.SW));
        state.setDefaultLanguage(ResponseLanguage.SW);
        assertEquals(ResponseLanguage.SW, policy.choose(state, new LanguageResult(ResponseLanguage.SHENG, 0.95, false)));
        assertEquals(ResponseLanguage.SW, policy.choose(state, new LanguageResult(ResponseLanguage.MIXED, 0.95, false)));
    }

    @Test
    @DisplayName("A stored customer preference always wins")
    void testPreference() {
        state.setCustomerLanguagePref(ResponseLanguage.SHENG);
        policy.apply(state, new LanguageResult(ResponseLanguage.EN, 0.99, false));
        assertEquals(ResponseLanguage.SHENG, state.getResponseLanguage());
        assertEquals(0.99, state.getLanguageConfidence());
    }
}
