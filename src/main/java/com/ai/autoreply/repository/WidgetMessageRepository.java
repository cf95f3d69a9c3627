package com.ai.autoreply.repository;

import com.ai.autoreply.entity.WidgetMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WidgetMessageRepository extends JpaRepository<WidgetMessage, Long> {

    List<WidgetMessage> findByAgentIdAndSessionIdOrderByIdDesc(Long agentId, String sessionId, Pageable pageable);
}
