package com.ai.commerce.controller;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.InboundAck;
import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.dto.ProcessingState;
import com.ai.commerce.dto.ProcessingStatus;
import com.ai.commerce.journey.CatalogReturnService;
import com.ai.commerce.service.ConversationStateService;
import com.ai.commerce.service.HandoffTicketService;
import com.ai.commerce.service.InboundMessageProcessor;
import com.ai.commerce.service.MessageDeduplicationLock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InboundMessageController.class)
@DisplayName("InboundMessageController - HTTP surface")
class InboundMessageControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private InboundMessageProcessor processor;

    @MockBean
    private ConversationStateService stateService;

    @MockBean
    private HandoffTicketService ticketService;

    @MockBean
    private CatalogReturnService catalogReturnService;

    @MockBean
    private MessageDeduplicationLock deduplicationLock;

    @Test
    @DisplayName("Inbound message is acknowledged with 202")
    void testInbound() throws Exception {
        when(processor.accept(any(InboundMessage.class)))
                .thenReturn(new InboundAck(InboundAck.Status.ACCEPTED, "conv-1:m1:abc"));

        mvc.perform(post("/api/v1/messages/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenant_id\":\"t1\",\"conversation_id\":\"conv-1\",\"message_id\":\"m1\",\"message_text\":\"hi\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.fingerprint").value("conv-1:m1:abc"));
    }

    @Test
    @DisplayName("Missing ids are rejected with the offending field")
    void testInboundValidation() throws Exception {
        mvc.perform(post("/api/v1/messages/inbound")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenant_id\":\"t1\",\"message_id\":\"m1\",\"message_text\":\"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("conversationId"));

        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("State endpoint returns the stored document or 404")
    void testState() throws Exception {
        String json = ConversationState.createInitial("t1", "conv-1", "req-1").toJson();
        when(stateService.loadJson("t1", "conv-1")).thenReturn(Optional.of(json));
        when(stateService.loadJson("t1", "missing")).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/tenants/t1/conversations/conv-1/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenant_id").value("t1"))
                .andExpect(jsonPath("$.journey").value("unknown"));
        mvc.perform(get("/api/v1/tenants/t1/conversations/missing/state"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Catalog selection resumes the conversation")
    void testCatalogSelection() throws Exception {
        ConversationState state = ConversationState.createInitial("t1", "conv-1", "req-1");
        state.setSelectedItemIds(List.of("sku-1"));
        state.setResponseText("Great choice!");
        when(catalogReturnService.returnFromCatalog(eq("t1"), eq("conv-1"), eq("req-9"), eq(List.of("sku-1"))))
                .thenReturn(Optional.of(state));

        mvc.perform(post("/api/v1/tenants/t1/conversations/conv-1/catalog-selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request_id\":\"req-9\",\"item_ids\":[\"sku-1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_text").value("Great choice!"))
                .andExpect(jsonPath("$.selected_item_ids[0]").value("sku-1"));
    }

    @Test
    @DisplayName("Admin endpoints expose processing state and force-release locks")
    void testAdmin() throws Exception {
        when(deduplicationLock.getProcessingState("fp-1"))
                .thenReturn(Optional.of(ProcessingState.builder().status(ProcessingStatus.PROCESSING).owner("worker-a").build()));
        when(deduplicationLock.forceReleaseLock("fp-1")).thenReturn(true);

        mvc.perform(get("/api/v1/admin/messages/fp-1/processing-state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.owner").value("worker-a"));
        mvc.perform(post("/api/v1/admin/messages/fp-1/release-lock"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.released").value(true));
    }
}
