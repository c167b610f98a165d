package com.ai.commerce.component;

import com.ai.commerce.conversation.ConversationState;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds web catalog links that bring the customer back into the same conversation.
 */
@Component
public class CatalogLinkBuilder {

    static final String RETURN_CONTEXT = "whatsapp";

    /** Null when the tenant has no catalog site configured. */
    public String catalogUrl(ConversationState state, String productId, String searchQuery) {
        if (StringUtils.isBlank(state.getCatalogLinkBase())) {
            return null;
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(state.getCatalogLinkBase())
                .queryParam("tenant_id", state.getTenantId());
        if (StringUtils.isNotBlank(productId)) {
            builder.queryParam("product_id", productId);
        }
        if (StringUtils.isNotBlank(searchQuery)) {
            builder.queryParam("search", searchQuery.trim());
        }
        return builder.queryParam("conversation_id", state.getConversationId())
                .queryParam("return_context", RETURN_CONTEXT)
                .encode()
                .toUriString();
    }
}
