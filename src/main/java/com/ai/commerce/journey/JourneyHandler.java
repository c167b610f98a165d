package com.ai.commerce.journey;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;

import java.util.Set;

/**
 * Executes one or more journeys for the current turn and sets the response text.
 */
public interface JourneyHandler {

    Set<Journey> journeys();

    ConversationState handle(ConversationState state);
}
