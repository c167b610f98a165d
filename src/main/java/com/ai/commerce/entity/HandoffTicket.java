package com.ai.commerce.entity;

import com.ai.commerce.conversation.HandoffPriority;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Request for a human agent to take over a conversation.
 */
@Entity
@Table(name = "handoff_ticket", indexes = {
    @Index(name = "idx_handoff_ticket_number", columnList = "ticket_number", unique = true),
    @Index(name = "idx_handoff_conversation", columnList = "tenant_id, conversation_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HandoffTicket {

    public enum Status {
        OPEN,
        ASSIGNED,
        CLOSED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_number", nullable = false)
    private String ticketNumber;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "conversation_id", nullable = false)
    private String conversationId;

    private String customerId;

    @Column(nullable = false)
    private String triggerName;

    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private HandoffPriority priority;

    @Column(length = 1000)
    private String reason;

    @Column(length = 4000)
    private String lastMessage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.OPEN;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
