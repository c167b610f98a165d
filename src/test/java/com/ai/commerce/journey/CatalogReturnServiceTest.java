package com.ai.commerce.journey;

import com.ai.commerce.component.CatalogLinkBuilder;
import com.ai.commerce.component.ResponsePhrases;
import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.service.CatalogFallbackPolicy;
import com.ai.commerce.service.CatalogSearchClient;
import com.ai.commerce.service.ConversationStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CatalogReturnService - resuming after a catalog visit")
class CatalogReturnServiceTest {

    private ConversationStateService stateService;
    private CatalogReturnService service;

    @BeforeEach
    void setUp() {
        stateService = mock(ConversationStateService.class);
        SalesJourneyHandler sales = new SalesJourneyHandler(mock(CatalogSearchClient.class), new CatalogFallbackPolicy(),
                new CatalogLinkBuilder(), new ResponsePhrases());
        service = new CatalogReturnService(stateService, sales);
        when(stateService.save(any(ConversationState.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("Unknown conversation returns empty and saves nothing")
    void testUnknownConversation() {
        when(stateService.load("tenant-1", "missing")).thenReturn(Optional.empty());

        assertTrue(service.returnFromCatalog("tenant-1", "missing", "req-9", List.of("p1")).isEmpty());
        verify(stateService, never()).save(any());
    }

    @Test
    @DisplayName("Known conversation stores the picks and clears shortlist rejections")
    void testSelectionSaved() {
        ConversationState stored = ConversationState.createInitial("tenant-1", "conv-1", "req-1");
        stored.incrementShortlistRejections();
        stored.incrementShortlistRejections();
        when(stateService.load("tenant-1", "conv-1")).thenReturn(Optional.of(stored));

        ConversationState result = service.returnFromCatalog("tenant-1", "conv-1", "req-2",
                Arrays.asList("p1", " ", "p7")).orElseThrow();

        ArgumentCaptor<ConversationState> saved = ArgumentCaptor.forClass(ConversationState.class);
        verify(stateService).save(saved.capture());
        assertSame(result, saved.getValue());
        assertEquals(List.of("p1", "p7"), result.getSelectedItemIds());
        assertEquals(0, result.getShortlistRejections());
        assertEquals(Journey.SALES, result.getJourney());
        assertEquals("req-2", result.getRequestId());
        assertEquals(new ResponsePhrases().catalogSelectionReceived(2), result.getResponseText());
    }

    @Test
    @DisplayName("A return without picks asks what to shop for and gets a request id")
    void testEmptySelection() {
        when(stateService.load("tenant-1", "conv-1"))
                .thenReturn(Optional.of(ConversationState.createInitial("tenant-1", "conv-1", "req-1")));

        ConversationState result = service.returnFromCatalog("tenant-1", "conv-1", null, null).orElseThrow();

        assertTrue(result.getSelectedItemIds().isEmpty());
        assertEquals(new ResponsePhrases().askWhatToShopFor(), result.getResponseText());
        assertNotNull(result.getRequestId());
        assertNotEquals("req-1", result.getRequestId());
    }
}
