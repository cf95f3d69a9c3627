package com.ai.autoreply.repository;

import com.ai.autoreply.entity.AgentDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AgentDocumentRepository extends JpaRepository<AgentDocument, Long> {

    List<AgentDocument> findByAgentIdOrderByIdAsc(Long agentId);
}
