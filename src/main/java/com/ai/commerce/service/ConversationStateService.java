package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.entity.ConversationStateEntity;
import com.ai.commerce.repository.ConversationStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Stores one validated state document per (tenant, conversation). Writes take a row lock so
 * concurrent turns on the same conversation replace the document one at a time.
 */
@Service
public class ConversationStateService {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateService.class);

    private final ConversationStateRepository repository;

    public ConversationStateService(ConversationStateRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Optional<ConversationState> load(String tenantId, String conversationId) {
        return repository.findByTenantIdAndConversationId(tenantId, conversationId)
                .map(entity -> ConversationState.fromJson(entity.getStateJson()));
    }

    @Transactional(readOnly = true)
    public Optional<String> loadJson(String tenantId, String conversationId) {
        return repository.findByTenantIdAndConversationId(tenantId, conversationId)
                .map(ConversationStateEntity::getStateJson);
    }

    /** Validates and stores the state; an invalid state is rejected before anything is written. */
    @Transactional
    public ConversationState save(ConversationState state) {
        String json = state.toJson();
        ConversationStateEntity entity = repository.findForUpdate(state.getTenantId(), state.getConversationId())
                .orElseGet(() -> ConversationStateEntity.builder()
                        .tenantId(state.getTenantId())
                        .conversationId(state.getConversationId())
                        .build());
        entity.setRequestId(state.getRequestId());
        entity.setStateJson(json);
        repository.save(entity);
        log.debug("[{}] state saved at turn {}", state.getConversationId(), state.getTurnCount());
        return state;
    }
}
