package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.ResponseLanguage;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tenant settings from {@code orchestrator.tenant.*}; every tenant shares them.
 */
@Service
public class PropertiesTenantDirectory implements TenantDirectory {

    private final String tenantName;
    private final String botName;
    private final String toneStyle;
    private final ResponseLanguage defaultLanguage;
    private final List<ResponseLanguage> allowedLanguages;
    private final int chattinessLevel;
    private final String catalogLinkBase;

    public PropertiesTenantDirectory(@Value("${orchestrator.tenant.name:}") String tenantName,
                                     @Value("${orchestrator.tenant.bot-name:}") String botName,
                                     @Value("${orchestrator.tenant.tone-style:" + ConversationState.DEFAULT_TONE_STYLE + "}") String toneStyle,
                                     @Value("${orchestrator.tenant.default-language:en}") String defaultLanguage,
                                     @Value("${orchestrator.tenant.allowed-languages:en,sw,sheng}") List<String> allowedLanguages,
                                     @Value("${orchestrator.tenant.chattiness-level:2}") int chattinessLevel,
                                     @Value("${orchestrator.tenant.catalog-link-base:}") String catalogLinkBase) {
        this.tenantName = StringUtils.trimToNull(tenantName);
        this.botName = StringUtils.trimToNull(botName);
        this.toneStyle = toneStyle;
        this.defaultLanguage = ResponseLanguage.fromValue(defaultLanguage.trim());
        this.allowedLanguages = allowedLanguages.stream()
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .map(ResponseLanguage::fromValue)
                .collect(Collectors.toList());
        this.chattinessLevel = chattinessLevel;
        this.catalogLinkBase = StringUtils.trimToNull(catalogLinkBase);
    }

    @Override
    public ConversationState resolve(ConversationState state) {
        state.setTenantName(tenantName);
        state.setBotName(botName);
        state.setToneStyle(toneStyle);
        state.setAllowedLanguages(allowedLanguages);
        state.setDefaultLanguage(defaultLanguage);
        state.setMaxChattinessLevel(chattinessLevel);
        state.setCatalogLinkBase(catalogLinkBase);
        return state;
    }
}
