package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EscalationDetector - priority-ordered rules")
class EscalationDetectorTest {

    private final EscalationDetector detector = new EscalationDetector();
    private ConversationState state;

    @BeforeEach
    void setUp() {
        state = ConversationState.createInitial("tenant-1", "conv-1", "req-1");
        state.incrementTurn();
    }

    private EscalationTrigger triggerFor(String message) {
        return detector.detect(state, message).map(RouteDecision::getEscalationTrigger).orElse(null);
    }

    @Test
    @DisplayName("Explicit human request routes to governance with confidence 1.0")
    void testHumanRequest() {
        RouteDecision decision = detector.detect(state, "I want to speak to a human").orElseThrow();
        assertEquals(Journey.GOVERNANCE, decision.getJourney());
        assertEquals(EscalationTrigger.EXPLICIT_HUMAN_REQUEST, decision.getEscalationTrigger());
        assertEquals(1.0, decision.getConfidence());
        assertFalse(decision.isShouldClarify());
        assertTrue(decision.isEscalation());
        assertEquals("high", decision.getString(RouteDecision.ESCALATION_PRIORITY));
    }

    @Test
    @DisplayName("Human request wins over abusive wording in the same message")
    void testHumanBeatsAbuse() {
        assertEquals(EscalationTrigger.EXPLICIT_HUMAN_REQUEST, triggerFor("this bot is shit, get me a human now"));
    }

    @Test
    @DisplayName("Already-flagged conversations stay escalated")
    void testStateFlagged() {
        state.setEscalation("Abusive content detected", null);
        RouteDecision decision = detector.detect(state, "hello again").orElseThrow();
        assertEquals(EscalationTrigger.STATE_FLAGGED, decision.getEscalationTrigger());
        assertEquals("Abusive content detected", decision.getString(RouteDecision.ESCALATION_REASON));
    }

    @Test
    @DisplayName("Payment disputes and sensitive content carry their own triggers")
    void testPaymentAndSensitive() {
        assertEquals(EscalationTrigger.PAYMENT_DISPUTE, triggerFor("I paid but nothing happened"));
        assertEquals(EscalationTrigger.PAYMENT_DISPUTE, triggerFor("I want a refund"));
        assertEquals(EscalationTrigger.SENSITIVE_CONTENT, triggerFor("I will talk to my lawyer"));
        assertEquals("urgent", detector.detect(state, "this is an emergency").orElseThrow()
                .getString(RouteDecision.ESCALATION_PRIORITY));
    }

    @Test
    @DisplayName("Payment dispute outranks sensitive content")
    void testOrder() {
        assertEquals(EscalationTrigger.PAYMENT_DISPUTE, triggerFor("chargeback or I call my lawyer"));
    }

    @Test
    @DisplayName("Frustration only escalates from the third turn")
    void testFrustrationNeedsTurns() {
        state.incrementTurn();
        assertNull(triggerFor("this is ridiculous"));

        state.incrementTurn();
        assertEquals(EscalationTrigger.USER_FRUSTRATION, triggerFor("this is ridiculous"));
    }

    @Test
    @DisplayName("Ordinary messages do not escalate")
    void testNoMatch() {
        assertTrue(detector.detect(state, "do you have red sneakers in size 42?").isEmpty());
        assertTrue(detector.detect(state, null).isEmpty());
    }

    @Test
    @DisplayName("Keywords only match whole words")
    void testWordBoundaries() {
        assertNull(triggerFor("my personal style is minimal"));
    }

    @Test
    @DisplayName("Repeated failures decision carries its category")
    void testRepeatedFailures() {
        RouteDecision decision = detector.decisionFor(EscalationTrigger.REPEATED_FAILURES, "stuck");
        assertEquals(Journey.GOVERNANCE, decision.getJourney());
        assertEquals("technical_issue", decision.getString(RouteDecision.ESCALATION_CATEGORY));
        assertEquals("medium", decision.getString(RouteDecision.ESCALATION_PRIORITY));
    }
}
