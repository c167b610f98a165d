package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.CatalogItem;
import com.ai.commerce.dto.CatalogSearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogFallbackPolicy - when to send a catalog link")
class CatalogFallbackPolicyTest {

    private final CatalogFallbackPolicy policy = new CatalogFallbackPolicy();
    private ConversationState state;

    @BeforeEach
    void setUp() {
        state = ConversationState.createInitial("tenant-1", "conv-1", "req-1");
    }

    private static CatalogItem item(String id, Double score) {
        return CatalogItem.builder().id(id).name("Item " + id).category("electronics").score(score).build();
    }

    private static List<CatalogItem> clearWinner() {
        return List.of(item("a", 0.95), item("b", 0.6), item("c", 0.5));
    }

    @Test
    @DisplayName("Large catalog plus a still-vague reply after a clarifying question")
    void testLargeCatalogVague() {
        assertTrue(policy.largeCatalogVagueQuery(50, 1, "anything"));
        assertTrue(policy.largeCatalogVagueQuery(200, 2, "shoes"));
        assertFalse(policy.largeCatalogVagueQuery(49, 1, "anything"));
        assertFalse(policy.largeCatalogVagueQuery(200, 0, "anything"));
        assertFalse(policy.largeCatalogVagueQuery(200, 1, "leather office shoes size 42"));
        assertFalse(policy.largeCatalogVagueQuery(null, 1, "anything"));
    }

    @Test
    @DisplayName("See-all phrases")
    void testSeeAll() {
        assertTrue(policy.seeAllRequested("can I browse everything?"));
        assertTrue(policy.seeAllRequested("Show all dresses"));
        assertFalse(policy.seeAllRequested("blue dress size 10"));
    }

    @Test
    @DisplayName("No clear winner: low top score, narrow spread or too few scored results")
    void testLowConfidence() {
        assertFalse(policy.lowConfidenceResults(clearWinner()));
        assertTrue(policy.lowConfidenceResults(List.of(item("a", 0.69), item("b", 0.3), item("c", 0.1))));
        assertTrue(policy.lowConfidenceResults(List.of(item("a", 0.9), item("b", 0.85), item("c", 0.82))));
        assertTrue(policy.lowConfidenceResults(List.of(item("a", 0.9), item("b", null))));
    }

    @Test
    @DisplayName("Visual categories or many variants need the web catalog")
    void testVisualSelection() {
        CatalogItem dress = CatalogItem.builder().id("d").name("Dress").category("Women's Clothing").build();
        CatalogItem colours = CatalogItem.builder().id("p").name("Phone case").category("electronics")
                .variants(List.of(Map.of("colour", "red"))).build();
        CatalogItem sizes = CatalogItem.builder().id("s").name("Charger").category("electronics")
                .variants(List.of(Map.of("watts", "20"), Map.of("watts", "30"), Map.of("watts", "45"), Map.of("watts", "65")))
                .build();
        CatalogItem plain = CatalogItem.builder().id("x").name("Cable").category("electronics")
                .variants(List.of(Map.of("length", "1m"))).build();

        assertTrue(policy.requiresVisualSelection(List.of(dress)));
        assertTrue(policy.requiresVisualSelection(List.of(colours)));
        assertTrue(policy.requiresVisualSelection(List.of(sizes)));
        assertFalse(policy.requiresVisualSelection(List.of(plain)));
    }

    @Test
    @DisplayName("Two shortlist rejections trigger the fallback")
    void testRejections() {
        assertFalse(policy.repeatedShortlistRejections(1));
        assertTrue(policy.repeatedShortlistRejections(2));
    }

    @Test
    @DisplayName("Evaluate reports the first matching reason in order")
    void testEvaluateOrder() {
        state.incrementCatalogClarifications();
        CatalogSearchResult large = new CatalogSearchResult(clearWinner(), 120);
        assertEquals(CatalogFallbackReason.LARGE_CATALOG_VAGUE_QUERY,
                policy.evaluate(state, "show me everything", large).orElseThrow());

        CatalogSearchResult small = new CatalogSearchResult(clearWinner(), 3);
        assertEquals(CatalogFallbackReason.SEE_ALL_REQUESTED,
                policy.evaluate(state, "show me the full catalog please", small).orElseThrow());

        state.incrementShortlistRejections();
        state.incrementShortlistRejections();
        assertEquals(CatalogFallbackReason.REPEATED_SHORTLIST_REJECTIONS,
                policy.evaluate(state, "samsung galaxy charger", small).orElseThrow());
    }

    @Test
    @DisplayName("A clear, specific result set stays inline")
    void testNoFallback() {
        CatalogSearchResult result = new CatalogSearchResult(clearWinner(), 3);
        assertTrue(policy.evaluate(state, "samsung galaxy charger", result).isEmpty());
    }
}
