package com.ai.autoreply.repository;

import com.ai.autoreply.entity.FaqUsageLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FaqUsageLogRepository extends JpaRepository<FaqUsageLog, Long> {
}
