package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.entity.HandoffTicket;
import com.ai.commerce.repository.HandoffTicketRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class HandoffTicketService {

    private static final Logger log = LoggerFactory.getLogger(HandoffTicketService.class);

    private final HandoffTicketRepository repository;

    public HandoffTicketService(HandoffTicketRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public HandoffTicket openTicket(ConversationState state, EscalationTrigger trigger, String reason) {
        HandoffTicket ticket = HandoffTicket.builder()
                .ticketNumber(newTicketNumber())
                .tenantId(state.getTenantId())
                .conversationId(state.getConversationId())
                .customerId(state.getCustomerId())
                .triggerName(trigger.getValue())
                .category(trigger.getCategory())
                .priority(trigger.getPriority())
                .reason(StringUtils.truncate(reason, 1000))
                .lastMessage(StringUtils.truncate(state.getIncomingMessage(), 4000))
                .build();
        HandoffTicket saved = repository.save(ticket);
        log.info("[{}] handoff ticket {} opened ({}, {})", state.getConversationId(), saved.getTicketNumber(),
                trigger.getValue(), trigger.getPriority());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<HandoffTicket> ticketsFor(String tenantId, String conversationId) {
        return repository.findByTenantIdAndConversationIdOrderByCreatedAtDesc(tenantId, conversationId);
    }

    private static String newTicketNumber() {
        return "HT-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
