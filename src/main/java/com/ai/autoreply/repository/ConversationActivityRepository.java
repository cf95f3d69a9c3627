package com.ai.autoreply.repository;

import com.ai.autoreply.entity.ConversationActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationActivityRepository extends JpaRepository<ConversationActivity, Long> {

    Optional<ConversationActivity> findByAgentIdAndPhoneNumber(Long agentId, String phoneNumber);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationActivity c SET c.lastUserMessageAt = :at, c.inactivityMessageSent = false "
            + "WHERE c.agentId = :agentId AND c.phoneNumber = :phone")
    int touchUserMessage(@Param("agentId") Long agentId, @Param("phone") String phoneNumber, @Param("at") Instant at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationActivity c SET c.lastAgentMessageAt = :at "
            + "WHERE c.agentId = :agentId AND c.phoneNumber = :phone")
    int touchAgentMessage(@Param("agentId") Long agentId, @Param("phone") String phoneNumber, @Param("at") Instant at);

    /**
     * Conversations where the agent replied last and the user has been silent since before {@code cutoff}.
     */
    @Query("SELECT c FROM ConversationActivity c WHERE c.agentId = :agentId "
            + "AND c.inactivityMessageSent = false "
            + "AND c.lastAgentMessageAt IS NOT NULL "
            + "AND c.lastAgentMessageAt > c.lastUserMessageAt "
            + "AND c.lastUserMessageAt < :cutoff")
    List<ConversationActivity> findAwaitingFollowUp(@Param("agentId") Long agentId, @Param("cutoff") Instant cutoff);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationActivity c SET c.inactivityMessageSent = true "
            + "WHERE c.id = :id AND c.inactivityMessageSent = false")
    int claimInactivityMessage(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ConversationActivity c SET c.inactivityMessageSent = false WHERE c.id = :id")
    int releaseInactivityMessage(@Param("id") Long id);
}
