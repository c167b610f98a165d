package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingReplyDispatcher implements ReplyDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingReplyDispatcher.class);

    @Override
    public void dispatch(InboundMessage message, ConversationState state) {
        log.info("[{}] reply to {} (journey={}, escalation={}): {}", message.conversationKey(), message.getMessageId(),
                state.getJourney().getValue(), state.isEscalationRequired(), state.getResponseText());
    }
}
