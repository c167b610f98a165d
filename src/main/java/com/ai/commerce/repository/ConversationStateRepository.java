package com.ai.commerce.repository;

import com.ai.commerce.entity.ConversationStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

@Repository
public interface ConversationStateRepository extends JpaRepository<ConversationStateEntity, Long> {

    Optional<ConversationStateEntity> findByTenantIdAndConversationId(String tenantId, String conversationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ConversationStateEntity s WHERE s.tenantId = :tenantId AND s.conversationId = :conversationId")
    Optional<ConversationStateEntity> findForUpdate(@Param("tenantId") String tenantId,
                                                    @Param("conversationId") String conversationId);
}
