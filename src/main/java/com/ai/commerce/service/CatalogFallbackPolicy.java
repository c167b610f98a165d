package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.CatalogItem;
import com.ai.commerce.dto.CatalogSearchResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides when a web catalog link serves the customer better than an inline shortlist.
 * Each predicate stands alone; {@link #evaluate} reports the first that holds.
 */
@Service
public class CatalogFallbackPolicy {

    private static final Logger log = LoggerFactory.getLogger(CatalogFallbackPolicy.class);

    public static final int LARGE_CATALOG_THRESHOLD = 50;
    public static final int VAGUE_MESSAGE_LENGTH = 10;
    public static final double CLEAR_WINNER_SCORE = 0.7;
    public static final double MIN_SCORE_SPREAD = 0.1;
    public static final int MAX_INLINE_VARIANTS = 3;
    public static final int MAX_SHORTLIST_REJECTIONS = 2;

    private static final Pattern SEE_ALL = Pattern.compile(
            "\\b(see all|show all|list all|view all|catalog|catalogue|browse|more options|all items|list everything|show everything|full catalog|complete list)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern VAGUE = Pattern.compile(
            "\\b(anything|whatever|don'?t know|not sure|maybe|something|good|nice|best|cheap|expensive|show me|what do you have|what'?s available)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Set<String> VISUAL_VARIANT_KEYS = Set.of("color", "colour", "style", "design", "pattern");

    private static final List<String> VISUAL_CATEGORIES = List.of(
            "clothing", "fashion", "shoes", "jewelry", "accessories", "furniture", "home decor", "art", "crafts");

    public Optional<CatalogFallbackReason> evaluate(ConversationState state, String message, CatalogSearchResult results) {
        List<CatalogItem> items = results != null ? results.getItems() : null;
        Integer totalMatches = results != null ? results.getTotalMatchesEstimate() : state.getCatalogTotalMatchesEstimate();

        boolean hasItems = items != null && !items.isEmpty();

        CatalogFallbackReason reason = null;
        if (largeCatalogVagueQuery(totalMatches, state.getCatalogClarifications(), message)) {
            reason = CatalogFallbackReason.LARGE_CATALOG_VAGUE_QUERY;
        } else if (seeAllRequested(message)) {
            reason = CatalogFallbackReason.SEE_ALL_REQUESTED;
        } else if (hasItems && lowConfidenceResults(items)) {
            reason = CatalogFallbackReason.LOW_CONFIDENCE_RESULTS;
        } else if (hasItems && requiresVisualSelection(items)) {
            reason = CatalogFallbackReason.VISUAL_SELECTION_REQUIRED;
        } else if (repeatedShortlistRejections(state.getShortlistRejections())) {
            reason = CatalogFallbackReason.REPEATED_SHORTLIST_REJECTIONS;
        }

        if (reason != null) {
            log.debug("[{}] catalog fallback: {}", state.getConversationId(), reason.getDescription());
        }
        return Optional.ofNullable(reason);
    }

    public boolean largeCatalogVagueQuery(Integer totalMatches, int clarificationsAsked, String message) {
        return totalMatches != null && totalMatches >= LARGE_CATALOG_THRESHOLD
                && clarificationsAsked >= 1
                && isVague(message);
    }

    public boolean isVague(String message) {
        String t = StringUtils.trimToEmpty(message);
        return t.length() < VAGUE_MESSAGE_LENGTH || VAGUE.matcher(t).find();
    }

    public boolean seeAllRequested(String message) {
        return SEE_ALL.matcher(StringUtils.defaultString(message)).find();
    }

    /** No clear winner among the top three scored results. */
    public boolean lowConfidenceResults(List<CatalogItem> items) {
        List<Double> topScores = items.stream()
                .map(CatalogItem::getScore)
                .filter(score -> score != null)
                .sorted(Comparator.reverseOrder())
                .limit(3)
                .collect(Collectors.toList());
        if (topScores.size() < 3) {
            return true;
        }
        double max = topScores.get(0);
        double min = topScores.get(topScores.size() - 1);
        return max < CLEAR_WINNER_SCORE || (max - min) < MIN_SCORE_SPREAD;
    }

    public boolean requiresVisualSelection(List<CatalogItem> items) {
        for (CatalogItem item : items) {
            List<Map<String, String>> variants = item.getVariants();
            if (variants != null) {
                if (variants.size() > MAX_INLINE_VARIANTS) {
                    return true;
                }
                for (Map<String, String> variant : variants) {
                    for (String key : variant.keySet()) {
                        if (VISUAL_VARIANT_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                            return true;
                        }
                    }
                }
            }
            String category = StringUtils.lowerCase(item.getCategory(), Locale.ROOT);
            if (category != null && VISUAL_CATEGORIES.stream().anyMatch(category::contains)) {
                return true;
            }
        }
        return false;
    }

    public boolean repeatedShortlistRejections(int rejections) {
        return rejections >= MAX_SHORTLIST_REJECTIONS;
    }
}
