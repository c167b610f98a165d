package com.ai.commerce.journey;

import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

@Component
public class UnknownJourneyHandler implements JourneyHandler {

    private final ResponsePhrases phrases;

    public UnknownJourneyHandler(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    @Override
    public Set<Journey> journeys() {
        return EnumSet.of(Journey.UNKNOWN);
    }

    @Override
    public ConversationState handle(ConversationState state) {
        if (state.needsClarification()) {
            RouteDecision decision = state.getRouteDecision();
            state.setResponseText(phrases.clarification(decision.getString(RouteDecision.INTENT),
                    decision.getString(RouteDecision.SUGGESTED_JOURNEY)));
        } else if (state.getTurnCount() <= 1) {
            state.setResponseText(phrases.greeting(state.getBotName()));
        } else {
            state.setResponseText(phrases.unknownRequest());
        }
        return state;
    }
}
