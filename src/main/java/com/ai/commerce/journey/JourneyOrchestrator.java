package com.ai.commerce.journey;

import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.IntentResult;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.exception.InvalidStateException;
import com.ai.commerce.exception.StageExecutionException;
import com.ai.commerce.service.ClassificationService;
import com.ai.commerce.service.ConversationStateService;
import com.ai.commerce.service.EscalationDetector;
import com.ai.commerce.service.GovernanceEngine;
import com.ai.commerce.service.IntentRouter;
import com.ai.commerce.service.LanguagePolicy;
import com.ai.commerce.service.TenantDirectory;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Runs one conversation turn through the fixed stage sequence:
 * entry, tenant_resolve, customer_resolve, intent_classify, language_policy, governance,
 * journey_router, journey_execution, response_generation, persistence.
 * <p>
 * A failing stage never aborts the turn. The failure flags the conversation for escalation and
 * the pipeline jumps to response_generation, which answers with a generic fallback message.
 */
@Service
public class JourneyOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JourneyOrchestrator.class);

    public static final String ENTRY = "entry";
    public static final String TENANT_RESOLVE = "tenant_resolve";
    public static final String CUSTOMER_RESOLVE = "customer_resolve";
    public static final String INTENT_CLASSIFY = "intent_classify";
    public static final String LANGUAGE_POLICY = "language_policy";
    public static final String GOVERNANCE = "governance";
    public static final String JOURNEY_ROUTER = "journey_router";
    public static final String JOURNEY_EXECUTION = "journey_execution";
    public static final String RESPONSE_GENERATION = "response_generation";
    public static final String PERSISTENCE = "persistence";

    public static final int MAX_CLARIFICATION_ROUNDS = 3;

    private final ConversationStateService stateService;
    private final ClassificationService classificationService;
    private final LanguagePolicy languagePolicy;
    private final GovernanceEngine governanceEngine;
    private final EscalationDetector escalationDetector;
    private final IntentRouter intentRouter;
    private final ResponsePhrases phrases;
    private final Map<Journey, JourneyHandler> handlers = new EnumMap<>(Journey.class);
    private final Map<String, UnaryOperator<ConversationState>> stages = new LinkedHashMap<>();

    public JourneyOrchestrator(ConversationStateService stateService,
                               TenantDirectory tenantDirectory,
                               ClassificationService classificationService,
                               LanguagePolicy languagePolicy,
                               GovernanceEngine governanceEngine,
                               EscalationDetector escalationDetector,
                               IntentRouter intentRouter,
                               List<JourneyHandler> journeyHandlers,
                               ResponsePhrases phrases) {
        this.stateService = stateService;
        this.classificationService = classificationService;
        this.languagePolicy = languagePolicy;
        this.governanceEngine = governanceEngine;
        this.escalationDetector = escalationDetector;
        this.intentRouter = intentRouter;
        this.phrases = phrases;

        for (JourneyHandler handler : journeyHandlers) {
            for (Journey journey : handler.journeys()) {
                JourneyHandler previous = handlers.put(journey, handler);
                if (previous != null) {
                    throw new IllegalStateException("Journey " + journey.getValue() + " handled by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        for (Journey journey : Journey.values()) {
            if (!handlers.containsKey(journey)) {
                throw new IllegalStateException("No handler registered for journey " + journey.getValue());
            }
        }

        stages.put(ENTRY, this::entry);
        stages.put(TENANT_RESOLVE, tenantDirectory::resolve);
        stages.put(CUSTOMER_RESOLVE, this::resolveCustomer);
        stages.put(INTENT_CLASSIFY, this::classifyIntent);
        stages.put(LANGUAGE_POLICY, this::applyLanguagePolicy);
        stages.put(GOVERNANCE, this::applyGovernance);
        stages.put(JOURNEY_ROUTER, this::routeJourney);
        stages.put(JOURNEY_EXECUTION, this::executeJourney);
        stages.put(RESPONSE_GENERATION, this::generateResponse);
        stages.put(PERSISTENCE, stateService::save);
    }

    public List<String> stageNames() {
        return List.copyOf(stages.keySet());
    }

    /**
     * Processes one inbound message. When {@code existing} is null the stored state is loaded,
     * or a new conversation is started.
     *
     * @return the state after the turn, always carrying a customer-facing response
     */
    public ConversationState process(InboundMessage message, ConversationState existing) {
        String requestId = StringUtils.defaultIfBlank(message.getRequestId(), UUID.randomUUID().toString());
        ConversationState state = existing != null ? existing : loadOrCreate(message, requestId);

        state.beginTurn(requestId, message.getMessageText());
        if (StringUtils.isNotBlank(message.getCustomerId())) {
            state.setCustomerId(message.getCustomerId());
        }
        if (StringUtils.isNotBlank(message.getPhone())) {
            state.setPhone(message.getPhone());
        }
        return run(state);
    }

    ConversationState run(ConversationState state) {
        ConversationState current = state;
        for (Map.Entry<String, UnaryOperator<ConversationState>> entry : stages.entrySet()) {
            String stage = entry.getKey();
            if (current.getFailedStage() != null && !RESPONSE_GENERATION.equals(stage) && !PERSISTENCE.equals(stage)) {
                continue;
            }
            try {
                ConversationState next = entry.getValue().apply(current);
                if (next == null) {
                    throw new IllegalStateException("stage returned no state");
                }
                current = next;
                log.debug("[{}] stage {} done", current.getConversationId(), stage);
            } catch (RuntimeException e) {
                StageExecutionException failure = new StageExecutionException(stage, e);
                log.error("[{}] {}", current.getConversationId(), failure.getMessage(), failure);
                if (current.getFailedStage() == null) {
                    current.setFailedStage(stage);
                }
                current.setEscalation(failure.getMessage(), null);
            }
        }
        if (StringUtils.isBlank(current.getResponseText())) {
            current.setResponseText(phrases.systemFallback());
        }
        log.info("[{}] turn {} done: intent={} journey={} escalation={}", current.getConversationId(),
                current.getTurnCount(), current.getIntent().getValue(), current.getJourney().getValue(),
                current.isEscalationRequired());
        return current;
    }

    private ConversationState loadOrCreate(InboundMessage message, String requestId) {
        try {
            return stateService.load(message.getTenantId(), message.getConversationId())
                    .orElseGet(() -> ConversationState.createInitial(message.getTenantId(), message.getConversationId(), requestId));
        } catch (InvalidStateException e) {
            log.error("[{}] stored state is invalid ({}), starting a new conversation record",
                    message.getConversationId(), e.getField(), e);
            return ConversationState.createInitial(message.getTenantId(), message.getConversationId(), requestId);
        }
    }

    private ConversationState entry(ConversationState state) {
        state.incrementTurn();
        return state;
    }

    private ConversationState resolveCustomer(ConversationState state) {
        if (StringUtils.isNotBlank(state.getPhone())) {
            state.setPhone(normalizePhone(state.getPhone()));
        }
        return state;
    }

    private ConversationState classifyIntent(ConversationState state) {
        IntentResult result = classificationService.classifyIntent(state);
        state.updateIntent(result.getIntent(), result.getConfidence());
        return state;
    }

    private ConversationState applyLanguagePolicy(ConversationState state) {
        return languagePolicy.apply(state, classificationService.classifyLanguage(state));
    }

    private ConversationState applyGovernance(ConversationState state) {
        GovernanceResult result = classificationService.classifyGovernance(state);
        state.updateGovernor(result.getClassification(), result.getConfidence());
        governanceEngine.evaluate(state, result).ifPresent(state::setGovernanceDecision);
        return state;
    }

    /** Escalation rules first, then the governance redirect, then intent routing. */
    private ConversationState routeJourney(ConversationState state) {
        RouteDecision decision = escalationDetector.detect(state, state.getIncomingMessage()).orElse(null);
        if (decision == null) {
            decision = state.getGovernanceDecision();
        }
        if (decision == null) {
            decision = routeByIntent(state);
        }

        if (decision.isEscalation() && !state.isEscalationRequired()) {
            state.setEscalation(StringUtils.defaultIfBlank(decision.getString(RouteDecision.ESCALATION_REASON),
                    decision.getReason()), null);
        }
        state.setRouteDecision(decision);
        state.setJourney(decision.getJourney());
        log.debug("[{}] routed: {}", state.getConversationId(), decision);
        return state;
    }

    private RouteDecision routeByIntent(ConversationState state) {
        RouteDecision decision = intentRouter.route(state.getIntent(), state.getIntentConfidence());
        if (!decision.isShouldClarify()) {
            state.resetClarificationRounds();
            return decision;
        }
        state.incrementClarificationRounds();
        if (state.getClarificationRounds() < MAX_CLARIFICATION_ROUNDS) {
            return decision;
        }
        log.warn("[{}] still unclear after {} clarification rounds, escalating", state.getConversationId(),
                state.getClarificationRounds());
        state.resetClarificationRounds();
        return escalationDetector.decisionFor(EscalationTrigger.REPEATED_FAILURES,
                "Intent still unclear after " + MAX_CLARIFICATION_ROUNDS + " clarification rounds");
    }

    private ConversationState executeJourney(ConversationState state) {
        return handlers.get(state.getJourney()).handle(state);
    }

    private ConversationState generateResponse(ConversationState state) {
        if (state.getFailedStage() != null || StringUtils.isBlank(state.getResponseText())) {
            state.setResponseText(phrases.systemFallback());
        } else {
            state.setResponseText(state.getResponseText().trim());
        }
        return state;
    }

    static String normalizePhone(String phone) {
        String trimmed = phone.trim();
        String digits = trimmed.replaceAll("[^0-9]", "");
        return trimmed.startsWith("+") ? "+" + digits : digits;
    }
}
