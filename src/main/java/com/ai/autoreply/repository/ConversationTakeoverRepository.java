package com.ai.autoreply.repository;

import com.ai.autoreply.entity.ConversationTakeover;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ConversationTakeoverRepository extends JpaRepository<ConversationTakeover, Long> {

    Optional<ConversationTakeover> findByAgentIdAndPhoneNumber(Long agentId, String phoneNumber);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationTakeover t SET t.takenOverAt = :at WHERE t.agentId = :agentId AND t.phoneNumber = :phone")
    int refresh(@Param("agentId") Long agentId, @Param("phone") String phoneNumber, @Param("at") Instant at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ConversationTakeover t WHERE t.agentId = :agentId AND t.phoneNumber = :phone")
    int deleteByConversation(@Param("agentId") Long agentId, @Param("phone") String phoneNumber);
}
