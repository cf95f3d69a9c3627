package com.ai.autoreply.repository;

import com.ai.autoreply.entity.AgentMedia;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentMediaRepository extends JpaRepository<AgentMedia, Long> {

    List<AgentMedia> findByAgentIdOrderByIdAsc(Long agentId);
}
