package com.ai.commerce.repository;

import com.ai.commerce.entity.HandoffTicket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HandoffTicketRepository extends JpaRepository<HandoffTicket, Long> {

    List<HandoffTicket> findByTenantIdAndConversationIdOrderByCreatedAtDesc(String tenantId, String conversationId);
}
