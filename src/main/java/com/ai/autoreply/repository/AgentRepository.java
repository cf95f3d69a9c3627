package com.ai.autoreply.repository;

import com.ai.autoreply.entity.Agent;
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
public interface AgentRepository extends JpaRepository<Agent, Long> {

    Optional<Agent> findFirstByInstanceNameAndStatus(String instanceName, Agent.Status status);

    Optional<Agent> findByIdAndWidgetEnabledTrue(Long id);

    List<Agent> findByStatusAndGhostModeFalseAndInactivityEnabledTrue(Agent.Status status);

    @Transactional
    @Modifying
    @Query("UPDATE Agent a SET a.messagesCount = a.messagesCount + 1, a.updatedAt = :at WHERE a.id = :id")
    int incrementMessagesCount(@Param("id") Long id, @Param("at") Instant at);
}
