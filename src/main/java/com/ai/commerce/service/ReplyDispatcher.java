package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.InboundMessage;

/**
 * Sends the reply of a processed turn back through the customer's channel.
 */
public interface ReplyDispatcher {

    void dispatch(InboundMessage message, ConversationState state);
}
