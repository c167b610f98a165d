package com.ai.commerce.controller;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.dto.CatalogSelectionRequest;
import com.ai.commerce.dto.InboundAck;
import com.ai.commerce.dto.InboundMessage;
import com.ai.commerce.dto.ProcessingState;
import com.ai.commerce.entity.HandoffTicket;
import com.ai.commerce.exception.InvalidStateException;
import com.ai.commerce.journey.CatalogReturnService;
import com.ai.commerce.service.ConversationStateService;
import com.ai.commerce.service.HandoffTicketService;
import com.ai.commerce.service.InboundMessageProcessor;
import com.ai.commerce.service.MessageDeduplicationLock;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class InboundMessageController {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageController.class);

    private final InboundMessageProcessor processor;
    private final ConversationStateService stateService;
    private final HandoffTicketService ticketService;
    private final CatalogReturnService catalogReturnService;
    private final MessageDeduplicationLock deduplicationLock;

    public InboundMessageController(InboundMessageProcessor processor,
                                    ConversationStateService stateService,
                                    HandoffTicketService ticketService,
                                    CatalogReturnService catalogReturnService,
                                    MessageDeduplicationLock deduplicationLock) {
        this.processor = processor;
        this.stateService = stateService;
        this.ticketService = ticketService;
        this.catalogReturnService = catalogReturnService;
        this.deduplicationLock = deduplicationLock;
    }

    @PostMapping("/messages/inbound")
    public ResponseEntity<InboundAck> inbound(@Valid @RequestBody InboundMessage message) {
        InboundAck ack = processor.accept(message);
        log.info("[{}] inbound {} -> {}", message.conversationKey(), message.getMessageId(), ack.getStatus());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }

    @GetMapping(value = "/tenants/{tenantId}/conversations/{conversationId}/state", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> state(@PathVariable String tenantId, @PathVariable String conversationId) {
        return stateService.loadJson(tenantId, conversationId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/tenants/{tenantId}/conversations/{conversationId}/handoffs")
    public List<HandoffTicket> handoffs(@PathVariable String tenantId, @PathVariable String conversationId) {
        return ticketService.ticketsFor(tenantId, conversationId);
    }

    @PostMapping("/tenants/{tenantId}/conversations/{conversationId}/catalog-selection")
    public ResponseEntity<Map<String, Object>> catalogSelection(@PathVariable String tenantId,
                                                                @PathVariable String conversationId,
                                                                @RequestBody CatalogSelectionRequest request) {
        return catalogReturnService.returnFromCatalog(tenantId, conversationId, request.getRequestId(), request.getItemIds())
                .map(state -> {
                    Map<String, Object> body = new HashMap<>();
                    body.put("response_text", state.getResponseText());
                    body.put("selected_item_ids", state.getSelectedItemIds());
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/admin/messages/{fingerprint}/processing-state")
    public ResponseEntity<ProcessingState> processingState(@PathVariable String fingerprint) {
        return deduplicationLock.getProcessingState(fingerprint)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/admin/messages/{fingerprint}/release-lock")
    public Map<String, Object> releaseLock(@PathVariable String fingerprint) {
        return Map.of("fingerprint", fingerprint, "released", deduplicationLock.forceReleaseLock(fingerprint));
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Map<String, String>> invalidState(InvalidStateException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return badRequest(e.getMessage(), e.getField());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String field = fieldError != null ? fieldError.getField() : null;
        String message = fieldError != null ? field + " " + fieldError.getDefaultMessage() : "invalid request";
        return badRequest(message, field);
    }

    private static ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        Map<String, String> body = new HashMap<>();
        body.put("error", error);
        body.put("field", field);
        return ResponseEntity.badRequest().body(body);
    }
}
