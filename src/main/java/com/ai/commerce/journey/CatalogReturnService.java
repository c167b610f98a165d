package com.ai.commerce.journey;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.service.ConversationStateService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resumes a stored conversation when the customer comes back from the web catalog.
 */
@Service
public class CatalogReturnService {

    private final ConversationStateService stateService;
    private final SalesJourneyHandler salesJourneyHandler;

    public CatalogReturnService(ConversationStateService stateService, SalesJourneyHandler salesJourneyHandler) {
        this.stateService = stateService;
        this.salesJourneyHandler = salesJourneyHandler;
    }

    /** Empty when the conversation is unknown. */
    public Optional<ConversationState> returnFromCatalog(String tenantId, String conversationId, String requestId,
                                                         List<String> itemIds) {
        return stateService.load(tenantId, conversationId).map(state -> {
            state.beginTurn(StringUtils.defaultIfBlank(requestId, UUID.randomUUID().toString()), null);
            salesJourneyHandler.handleCatalogReturn(state, itemIds);
            return stateService.save(state);
        });
    }
}
