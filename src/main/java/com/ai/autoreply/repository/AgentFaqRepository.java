package com.ai.autoreply.repository;

import com.ai.autoreply.entity.AgentFaq;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface AgentFaqRepository extends JpaRepository<AgentFaq, Long> {

    List<AgentFaq> findByAgentIdAndActiveTrue(Long agentId);

    @Transactional
    @Modifying
    @Query("UPDATE AgentFaq f SET f.usageCount = f.usageCount + 1, f.updatedAt = :at WHERE f.id = :id")
    int incrementUsage(@Param("id") Long id, @Param("at") Instant at);
}
