package com.ai.commerce.journey;

import com.ai.commerce.component.CatalogLinkBuilder;
import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.GovernorClassification;
import com.ai.commerce.conversation.Intent;
import com.ai.commerce.conversation.IntentResult;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.conversation.ResponseLanguage;
import com.ai.commerce.dto.CatalogSearchResult;
import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.entity.HandoffTicket;
import com.ai.commerce.exception.InvalidStateException;
import com.ai.commerce.service.CatalogFallbackPolicy;
import com.ai.commerce.service.CatalogSearchClient;
import com.ai.commerce.service.ClassificationService;
import com.ai.commerce.service.ConversationStateService;
import com.ai.commerce.service.EscalationDetector;
import com.ai.commerce.service.GovernanceEngine;
import com.ai.commerce.service.HandoffTicketService;
import com.ai.commerce.service.IntentRouter;
import com.ai.commerce.service.KeywordLanguageClassifier;
import com.ai.commerce.service.LanguagePolicy;
import com.ai.commerce.service.PropertiesTenantDirectory;
import com.ai.commerce.service.RateLimitStatus;
import com.ai.commerce.service.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JourneyOrchestrator - full turns through the stage pipeline")
class JourneyOrchestratorTest {

    private final ResponsePhrases phrases = new ResponsePhrases();
    private ConversationStateService stateService;
    private ClassificationService classification;
    private HandoffTicketService ticketService;
    private RateLimiter rateLimiter;
    private CatalogSearchClient catalogSearch;
    private JourneyOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        stateService = mock(ConversationStateService.class);
        classification = mock(ClassificationService.class);
        ticketService = mock(HandoffTicketService.class);
        rateLimiter = mock(RateLimiter.class);
        catalogSearch = mock(CatalogSearchClient.class);

        when(stateService.load(anyString(), anyString())).thenReturn(Optional.empty());
        when(stateService.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(rateLimiter.checkRateLimit(anyString(), anyString())).thenReturn(RateLimitStatus.allowed());
        when(classification.classifyLanguage(any())).thenReturn(new LanguageResult(ResponseLanguage.EN, 0.9, false));
        when(classification.classifyGovernance(any())).thenReturn(GovernanceResult.of(GovernorClassification.BUSINESS, 0.9));
        when(ticketService.openTicket(any(), any(), anyString()))
                .thenReturn(HandoffTicket.builder().ticketNumber("HT-CAFE0001").build());
        when(catalogSearch.search(anyString(), anyString())).thenReturn(CatalogSearchResult.empty());

        orchestrator = build(List.of(
                new GovernanceJourneyHandler(ticketService, phrases),
                new SalesJourneyHandler(catalogSearch, new CatalogFallbackPolicy(), new CatalogLinkBuilder(), phrases),
                new ServiceJourneyHandler(phrases),
                new PreferencesJourneyHandler(new KeywordLanguageClassifier(), phrases),
                new UnknownJourneyHandler(phrases)));
    }

    private JourneyOrchestrator build(List<JourneyHandler> handlers) {
        PropertiesTenantDirectory tenants = new PropertiesTenantDirectory("Acme Stores", "Amina", "friendly_concise",
                "en", List.of("en", "sw", "sheng"), 2, "https://shop.example.com/catalog");
        return new JourneyOrchestrator(stateService, tenants, classification, new LanguagePolicy(),
                new GovernanceEngine(rateLimiter), new EscalationDetector(), new IntentRouter(), handlers, phrases);
    }

    private static InboundMessage message(String id, String text) {
        return InboundMessage.builder()
                .tenantId("tenant-1").conversationId("conv-1").messageId(id).requestId("req-" + id)
                .messageText(text).phone("+254 700 000 001")
                .build();
    }

    private void intent(Intent intent, double confidence) {
        when(classification.classifyIntent(any())).thenReturn(IntentResult.of(intent, confidence, null));
    }

    @Test
    @DisplayName("Stages run in the documented order")
    void testStageOrder() {
        assertEquals(List.of("entry", "tenant_resolve", "customer_resolve", "intent_classify", "language_policy",
                "governance", "journey_router", "journey_execution", "response_generation", "persistence"),
                orchestrator.stageNames());
    }

    @Test
    @DisplayName("First casual message gets a friendly reply and the tenant profile")
    void testCasualGreeting() {
        intent(Intent.SPAM_CASUAL, 0.9);
        when(classification.classifyGovernance(any())).thenReturn(GovernanceResult.of(GovernorClassification.CASUAL, 0.9));

        ConversationState state = orchestrator.process(message("m1", "hi there"), null);

        assertEquals(1, state.getTurnCount());
        assertEquals(1, state.getCasualTurns());
        assertEquals(Journey.GOVERNANCE, state.getJourney());
        assertEquals(phrases.friendlyCasual(1, 1), state.getResponseText());
        assertEquals("Amina", state.getBotName());
        assertEquals("Acme Stores", state.getTenantName());
        assertEquals("+254700000001", state.getPhone());
        assertFalse(state.isEscalationRequired());
        verify(stateService).save(state);
    }

    @Test
    @DisplayName("High-confidence order question goes straight to the orders journey")
    void testOrders() {
        intent(Intent.ORDER_STATUS, 0.91);

        ConversationState state = orchestrator.process(message("m1", "where is my order 1234?"), null);

        assertEquals(Journey.ORDERS, state.getJourney());
        assertEquals(Intent.ORDER_STATUS, state.getIntent());
        assertEquals(phrases.journeyAcknowledgement(Journey.ORDERS), state.getResponseText());
    }

    @Test
    @DisplayName("Explicit human request escalates and opens one ticket")
    void testHumanRequest() {
        intent(Intent.HUMAN_REQUEST, 0.95);

        ConversationState state = orchestrator.process(message("m1", "let me speak to a human please"), null);

        assertEquals(Journey.GOVERNANCE, state.getJourney());
        assertTrue(state.isEscalationRequired());
        assertEquals("HT-CAFE0001", state.getHandoffTicketId());
        assertTrue(state.getResponseText().contains("HT-CAFE0001"));
        verify(ticketService).openTicket(eq(state), eq(EscalationTrigger.EXPLICIT_HUMAN_REQUEST), anyString());

        intent(Intent.ORDER_STATUS, 0.9);
        orchestrator.process(message("m2", "any update?"), state);

        assertEquals(phrases.awaitingAgent("HT-CAFE0001"), state.getResponseText());
        verify(ticketService, times(1)).openTicket(any(), any(), anyString());
    }

    @Test
    @DisplayName("Escalation rules beat the intent router")
    void testEscalationOverridesIntent() {
        intent(Intent.SALES_DISCOVERY, 0.95);

        ConversationState state = orchestrator.process(message("m1", "I was charged twice for the shoes"), null);

        assertEquals(Journey.GOVERNANCE, state.getJourney());
        verify(ticketService).openTicket(eq(state), eq(EscalationTrigger.PAYMENT_DISPUTE), anyString());
    }

    @Test
    @DisplayName("Mid confidence asks to clarify, and the third unclear round escalates")
    void testClarificationBound() {
        intent(Intent.PRODUCT_QUESTION, 0.6);

        ConversationState state = orchestrator.process(message("m1", "that one"), null);
        assertEquals(Journey.UNKNOWN, state.getJourney());
        assertEquals(1, state.getClarificationRounds());
        assertEquals(phrases.clarification("product_question", "sales"), state.getResponseText());

        orchestrator.process(message("m2", "the thing"), state);
        assertEquals(2, state.getClarificationRounds());
        assertFalse(state.isEscalationRequired());

        orchestrator.process(message("m3", "you know"), state);
        assertEquals(0, state.getClarificationRounds());
        assertEquals(Journey.GOVERNANCE, state.getJourney());
        assertTrue(state.isEscalationRequired());
        verify(ticketService).openTicket(eq(state), eq(EscalationTrigger.REPEATED_FAILURES), anyString());
    }

    @Test
    @DisplayName("A clear answer resets the clarification counter")
    void testClarificationReset() {
        intent(Intent.PRODUCT_QUESTION, 0.6);
        ConversationState state = orchestrator.process(message("m1", "that one"), null);

        intent(Intent.SALES_DISCOVERY, 0.9);
        orchestrator.process(message("m2", "red sneakers size 40"), state);

        assertEquals(0, state.getClarificationRounds());
        assertEquals(Journey.SALES, state.getJourney());
    }

    @Test
    @DisplayName("A failing stage is contained: fallback reply, escalation flag, state still saved")
    void testStageFailure() {
        when(classification.classifyIntent(any())).thenThrow(new IllegalStateException("classifier exploded"));

        ConversationState state = orchestrator.process(message("m1", "hello"), null);

        assertEquals(JourneyOrchestrator.INTENT_CLASSIFY, state.getFailedStage());
        assertTrue(state.isEscalationRequired());
        assertEquals("System error in intent_classify", state.getEscalationReason());
        assertEquals(phrases.systemFallback(), state.getResponseText());
        assertEquals(Journey.UNKNOWN, state.getJourney());
        verify(stateService).save(state);
        verify(classification, never()).classifyGovernance(any());
    }

    @Test
    @DisplayName("A failed save still returns a reply")
    void testPersistenceFailure() {
        intent(Intent.ORDER_STATUS, 0.9);
        when(stateService.save(any())).thenThrow(new IllegalStateException("database down"));

        ConversationState state = orchestrator.process(message("m1", "order status"), null);

        assertEquals(JourneyOrchestrator.PERSISTENCE, state.getFailedStage());
        assertEquals(phrases.journeyAcknowledgement(Journey.ORDERS), state.getResponseText());
    }

    @Test
    @DisplayName("An unreadable stored state starts a fresh conversation")
    void testCorruptStoredState() {
        intent(Intent.ORDER_STATUS, 0.9);
        when(stateService.load("tenant-1", "conv-1")).thenThrow(new InvalidStateException("turn_count", "must not be negative"));

        ConversationState state = orchestrator.process(message("m1", "order status"), null);

        assertEquals(1, state.getTurnCount());
        assertEquals("req-m1", state.getRequestId());
        assertNull(state.getFailedStage());
    }

    @Test
    @DisplayName("Stored state is resumed across turns")
    void testResumeStoredState() {
        ConversationState stored = ConversationState.createInitial("tenant-1", "conv-1", "req-0");
        stored.incrementTurn();
        when(stateService.load("tenant-1", "conv-1")).thenReturn(Optional.of(stored));
        intent(Intent.ORDER_STATUS, 0.9);

        ConversationState state = orchestrator.process(message("m1", "order status"), null);

        assertSame(stored, state);
        assertEquals(2, state.getTurnCount());
    }

    @Test
    @DisplayName("Phone numbers are reduced to digits with an optional leading plus")
    void testNormalizePhone() {
        assertEquals("+254700000001", JourneyOrchestrator.normalizePhone(" +254 (700) 000-001 "));
        assertEquals("0700000001", JourneyOrchestrator.normalizePhone("0700 000 001"));
    }

    @Test
    @DisplayName("Every journey needs exactly one handler")
    void testHandlerRegistration() {
        List<JourneyHandler> missing = List.of(new UnknownJourneyHandler(phrases));
        assertThrows(IllegalStateException.class, () -> build(missing));

        List<JourneyHandler> duplicate = List.of(
                new GovernanceJourneyHandler(ticketService, phrases),
                new SalesJourneyHandler(catalogSearch, new CatalogFallbackPolicy(), new CatalogLinkBuilder(), phrases),
                new ServiceJourneyHandler(phrases),
                new PreferencesJourneyHandler(new KeywordLanguageClassifier(), phrases),
                new UnknownJourneyHandler(phrases),
                new UnknownJourneyHandler(phrases));
        assertThrows(IllegalStateException.class, () -> build(duplicate));
    }
}
