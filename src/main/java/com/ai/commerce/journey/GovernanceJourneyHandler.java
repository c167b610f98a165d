package com.ai.commerce.journey;

import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.GovernanceAction;
import com.ai.commerce.conversation.Intent;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import com.ai.commerce.entity.HandoffTicket;
import com.ai.commerce.service.HandoffTicketService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Replies for governance redirects (casual, spam, abuse, rate limits) and human handoffs.
 */
@Component
public class GovernanceJourneyHandler implements JourneyHandler {

    private static final Logger log = LoggerFactory.getLogger(GovernanceJourneyHandler.class);

    private final HandoffTicketService ticketService;
    private final ResponsePhrases phrases;

    public GovernanceJourneyHandler(HandoffTicketService ticketService, ResponsePhrases phrases) {
        this.ticketService = ticketService;
        this.phrases = phrases;
    }

    @Override
    public Set<Journey> journeys() {
        return EnumSet.of(Journey.GOVERNANCE);
    }

    @Override
    public ConversationState handle(ConversationState state) {
        RouteDecision decision = state.getRouteDecision();
        GovernanceAction action = decision != null ? decision.getGovernanceAction() : null;
        int turn = state.getTurnCount();

        if (action != null) {
            switch (action) {
                case REDIRECT_TO_BUSINESS:
                    state.setResponseText(phrases.businessRedirect(state.getMaxChattinessLevel(), state.getCasualTurns(), turn));
                    break;
                case FRIENDLY_CASUAL_RESPONSE:
                    state.setResponseText(phrases.friendlyCasual(state.getCasualTurns(), turn));
                    break;
                case SPAM_WARNING:
                    state.setResponseText(phrases.spamWarning(turn));
                    break;
                case DISENGAGE:
                    state.setResponseText(phrases.disengage(turn));
                    break;
                case ABUSE_STOP:
                    state.setResponseText(phrases.abuseStop());
                    break;
                case RATE_LIMITED:
                    state.setResponseText(phrases.rateLimited(decision.getString(RouteDecision.RATE_LIMIT_REASON)));
                    break;
                default:
                    state.setResponseText(phrases.businessRedirect(state.getMaxChattinessLevel(), state.getCasualTurns(), turn));
                    break;
            }
            return state;
        }

        EscalationTrigger trigger = decision != null ? decision.getEscalationTrigger() : null;
        if (trigger == null && state.getIntent() == Intent.HUMAN_REQUEST) {
            trigger = EscalationTrigger.EXPLICIT_HUMAN_REQUEST;
        }
        if (trigger != null) {
            String reason = decision != null && StringUtils.isNotBlank(decision.getString(RouteDecision.ESCALATION_REASON))
                    ? decision.getString(RouteDecision.ESCALATION_REASON)
                    : "Customer explicitly requested human assistance";
            return handoff(state, trigger, reason);
        }

        // spam_casual intent routed here without a governance verdict
        state.setResponseText(phrases.businessRedirect(state.getMaxChattinessLevel(), state.getCasualTurns(), turn));
        return state;
    }

    private ConversationState handoff(ConversationState state, EscalationTrigger trigger, String reason) {
        if (StringUtils.isNotBlank(state.getHandoffTicketId())) {
            state.setResponseText(phrases.awaitingAgent(state.getHandoffTicketId()));
            return state;
        }
        HandoffTicket ticket = ticketService.openTicket(state, trigger, reason);
        state.setEscalation(reason, ticket.getTicketNumber());
        log.info("[{}] handed off to a human ({})", state.getConversationId(), trigger.getValue());
        state.setResponseText(phrases.handoff(trigger, ticket.getTicketNumber()));
        return state;
    }
}
