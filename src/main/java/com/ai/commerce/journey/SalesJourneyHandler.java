package com.ai.commerce.journey;

import com.ai.commerce.component.CatalogLinkBuilder;
import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.dto.CatalogItem;
import com.ai.commerce.dto.CatalogSearchResult;
import com.ai.commerce.service.CatalogFallbackPolicy;
import com.ai.commerce.service.CatalogFallbackReason;
import com.ai.commerce.service.CatalogSearchClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Product discovery: searches the catalog and answers with an inline shortlist, or with a
 * web catalog link when the fallback policy says the choice is better made there.
 */
@Component
public class SalesJourneyHandler implements JourneyHandler {

    private static final Logger log = LoggerFactory.getLogger(SalesJourneyHandler.class);

    public static final int SHORTLIST_SIZE = 3;

    private static final Pattern SHORTLIST_REJECTION = Pattern.compile(
            "\\b(none of (these|those|them)|something else|not (these|those|what i want)|don'?t like (these|those|any)|other options|anything else)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final CatalogSearchClient catalogSearch;
    private final CatalogFallbackPolicy fallbackPolicy;
    private final CatalogLinkBuilder linkBuilder;
    private final ResponsePhrases phrases;

    public SalesJourneyHandler(CatalogSearchClient catalogSearch,
                               CatalogFallbackPolicy fallbackPolicy,
                               CatalogLinkBuilder linkBuilder,
                               ResponsePhrases phrases) {
        this.catalogSearch = catalogSearch;
        this.fallbackPolicy = fallbackPolicy;
        this.linkBuilder = linkBuilder;
        this.phrases = phrases;
    }

    @Override
    public Set<Journey> journeys() {
        return EnumSet.of(Journey.SALES);
    }

    @Override
    public ConversationState handle(ConversationState state) {
        String message = StringUtils.defaultString(state.getIncomingMessage());
        if (state.getPreviousJourney() == Journey.SALES && SHORTLIST_REJECTION.matcher(message).find()) {
            state.incrementShortlistRejections();
        }

        CatalogSearchResult results = catalogSearch.search(state.getTenantId(), message);
        if (results == null) {
            results = CatalogSearchResult.empty();
        }
        state.setLastCatalogQuery(message);
        state.setCatalogTotalMatchesEstimate(results.getTotalMatchesEstimate());

        Optional<CatalogFallbackReason> fallback = fallbackPolicy.evaluate(state, message, results);
        if (fallback.isPresent()) {
            String url = linkBuilder.catalogUrl(state, null, message);
            if (url != null) {
                log.info("[{}] sending catalog link: {}", state.getConversationId(), fallback.get().getDescription());
                state.setResponseText(phrases.catalogLink(fallback.get(), url));
                return state;
            }
        }

        List<CatalogItem> items = results.getItems();
        if (items != null && !items.isEmpty()) {
            List<CatalogItem> shortlist = new ArrayList<>(items.subList(0, Math.min(SHORTLIST_SIZE, items.size())));
            state.setResponseText(phrases.shortlist(shortlist));
            return state;
        }

        state.incrementCatalogClarifications();
        state.setResponseText(phrases.askWhatToShopFor());
        return state;
    }

    /** The customer picked items on the web catalog and came back to the chat. */
    public ConversationState handleCatalogReturn(ConversationState state, List<String> itemIds) {
        List<String> selected = new ArrayList<>();
        if (itemIds != null) {
            itemIds.stream().filter(StringUtils::isNotBlank).forEach(selected::add);
        }
        state.setSelectedItemIds(selected);
        state.resetShortlistRejections();
        state.setJourney(Journey.SALES);
        state.setResponseText(selected.isEmpty() ? phrases.askWhatToShopFor() : phrases.catalogSelectionReceived(selected.size()));
        log.info("[{}] catalog return with {} item(s)", state.getConversationId(), selected.size());
        return state;
    }
}
