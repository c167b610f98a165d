package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;

/**
 * Source of tenant configuration (bot persona, languages, chattiness, catalog site).
 */
public interface TenantDirectory {

    /** Copies the tenant's current settings onto the state. */
    ConversationState resolve(ConversationState state);
}
