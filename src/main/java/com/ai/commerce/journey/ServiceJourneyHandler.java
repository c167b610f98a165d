package com.ai.commerce.journey;

import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Support, order and offer turns: acknowledge and collect what the downstream team needs.
 */
@Component
public class ServiceJourneyHandler implements JourneyHandler {

    private final ResponsePhrases phrases;

    public ServiceJourneyHandler(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    @Override
    public Set<Journey> journeys() {
        return EnumSet.of(Journey.SUPPORT, Journey.ORDERS, Journey.OFFERS);
    }

    @Override
    public ConversationState handle(ConversationState state) {
        state.setResponseText(phrases.journeyAcknowledgement(state.getJourney()));
        return state;
    }
}
