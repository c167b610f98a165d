package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.GovernorClassification;
import com.ai.commerce.conversation.Intent;
import com.ai.commerce.conversation.ResponseLanguage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Keyword fallback classifiers")
class KeywordClassifiersTest {

    @Nested
    @DisplayName("Intent")
    class IntentRules {

        private final KeywordIntentClassifier classifier = new KeywordIntentClassifier();

        private Intent intentOf(String message) {
            return classifier.classify(message, 0.5).getIntent();
        }

        @Test
        @DisplayName("Rules are checked in order, first match wins")
        void testRuleOrder() {
            assertEquals(Intent.HUMAN_REQUEST, intentOf("let me talk to an agent about my order"));
            assertEquals(Intent.ORDER_STATUS, intentOf("where is my order, I paid already"));
            assertEquals(Intent.PAYMENT_HELP, intentOf("my mpesa payment failed"));
            assertEquals(Intent.DISCOUNTS_OFFERS, intentOf("any discounts this week?"));
            assertEquals(Intent.PREFERENCES_CONSENT, intentOf("change my language settings"));
            assertEquals(Intent.SUPPORT_QUESTION, intentOf("the zipper is broken"));
            assertEquals(Intent.PRODUCT_QUESTION, intentOf("is this item in stock"));
            assertEquals(Intent.SALES_DISCOVERY, intentOf("I am looking for running shoes"));
            assertEquals(Intent.SPAM_CASUAL, intentOf("hey there"));
        }

        @Test
        @DisplayName("Very short text is casual, anything else unmatched is unknown")
        void testFallthrough() {
            assertEquals(Intent.SPAM_CASUAL, intentOf("k"));
            assertEquals(Intent.UNKNOWN, intentOf("the weather in Mombasa"));
        }

        @Test
        @DisplayName("Result carries the supplied fallback confidence")
        void testConfidence() {
            assertEquals(0.6, classifier.classify("track my order", 0.6).getConfidence());
        }
    }

    @Nested
    @DisplayName("Governance")
    class GovernanceRules {

        private final KeywordGovernanceClassifier classifier = new KeywordGovernanceClassifier();
        private final ConversationState state = ConversationState.createInitial("t", "c", "r");

        private GovernorClassification of(String message) {
            return classifier.classification(message, state);
        }

        @Test
        @DisplayName("Abuse words are caught first")
        void testAbuse() {
            assertEquals(GovernorClassification.ABUSE, of("you stupid bot, I want to buy shoes"));
        }

        @Test
        @DisplayName("Spam shapes: empty, tiny, repeated characters, test words, symbols")
        void testSpamShapes() {
            assertEquals(GovernorClassification.SPAM, of(""));
            assertEquals(GovernorClassification.SPAM, of("ok"));
            assertEquals(GovernorClassification.SPAM, of("aaaaaaa"));
            assertEquals(GovernorClassification.SPAM, of("testing testing"));
            assertEquals(GovernorClassification.SPAM, of("?!?!?!?!!"));
        }

        @Test
        @DisplayName("Test words only match whole words")
        void testSpamWordBoundary() {
            assertEquals(GovernorClassification.BUSINESS, of("I'm interested in the latest phones"));
        }

        @Test
        @DisplayName("Business vocabulary beats casual phrasing")
        void testBusiness() {
            assertEquals(GovernorClassification.BUSINESS, of("hi, I want to buy a phone"));
        }

        @Test
        @DisplayName("Greetings and short questions are casual")
        void testCasual() {
            assertEquals(GovernorClassification.CASUAL, of("hello there"));
            assertEquals(GovernorClassification.CASUAL, of("who made you?"));
        }

        @Test
        @DisplayName("A confident business intent keeps small talk in business")
        void testBusinessIntentContext() {
            state.updateIntent(Intent.ORDER_STATUS, 0.8);
            assertEquals(GovernorClassification.BUSINESS, of("hello there"));
        }

        @Test
        @DisplayName("Unclear messages get the benefit of the doubt")
        void testDefaultBusiness() {
            assertEquals(GovernorClassification.BUSINESS, of("my cousin recommended you to me last week"));
        }
    }

    @Nested
    @DisplayName("Language")
    class LanguageRules {

        private final KeywordLanguageClassifier classifier = new KeywordLanguageClassifier();

        @Test
        @DisplayName("Explicit requests win")
        void testExplicit() {
            assertEquals(ResponseLanguage.SW, classifier.explicitRequest("please speak swahili"));
            assertEquals(ResponseLanguage.EN, classifier.explicitRequest("English please"));
            assertEquals(ResponseLanguage.SHENG, classifier.explicitRequest("ongea sheng bana"));
            assertNull(classifier.explicitRequest("red shoes"));
        }

        @Test
        @DisplayName("Word scores pick the language, code-switching is mixed")
        void testScores() {
            assertEquals(ResponseLanguage.SW, classifier.classify("habari, nataka viatu", 0.5).getResponseLanguage());
            assertEquals(ResponseLanguage.EN, classifier.classify("where can I find shoes", 0.5).getResponseLanguage());
            assertEquals(ResponseLanguage.MIXED, classifier.classify("habari, I want shoes", 0.5).getResponseLanguage());
            assertEquals(ResponseLanguage.EN, classifier.classify("", 0.5).getResponseLanguage());
        }
    }
}
