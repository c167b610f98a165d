package com.ai.commerce.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * One inbound chat message as handed over by the transport layer.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InboundMessage {

    @NotBlank
    private String tenantId;

    @NotBlank
    private String conversationId;

    /** Transport-level id of the message; part of the deduplication fingerprint. */
    @NotBlank
    private String messageId;

    private String requestId;

    private String messageText;

    private String phone;

    private String customerId;

    /** Set on a coalesced turn: the inbound messages it was built from, in arrival order. */
    @JsonIgnore
    @ToString.Exclude
    private List<InboundMessage> coalescedFrom;

    public String conversationKey() {
        return tenantId + ":" + conversationId;
    }

    /** The messages this turn answers: the coalesced ones, or just this message. */
    public List<InboundMessage> sourceMessages() {
        return coalescedFrom == null || coalescedFrom.isEmpty() ? List.of(this) : coalescedFrom;
    }
}
