package com.ai.autoreply.service;

import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.repository.SystemLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Writes operator-facing audit entries. A failed write is logged and swallowed.
 */
@Service
public class SystemLogService {

    private static final Logger log = LoggerFactory.getLogger(SystemLogService.class);

    private static final int MAX_ACTION_LENGTH = 500;

    private final SystemLogRepository systemLogRepository;
    private final ObjectMapper mapper;

    public SystemLogService(SystemLogRepository systemLogRepository, ObjectMapper mapper) {
        this.systemLogRepository = systemLogRepository;
        this.mapper = mapper;
    }

    public void record(Long agentId, SystemLog.Type type, String action, Map<String, ?> details,
                       String phoneNumber, SystemLog.Source source) {
        try {
            SystemLog entry = SystemLog.builder()
                    .agentId(agentId)
                    .type(type)
                    .action(StringUtils.abbreviate(action, MAX_ACTION_LENGTH))
                    .details(toJson(details))
                    .phoneNumber(phoneNumber)
                    .source(source)
                    .build();
            systemLogRepository.save(entry);
        } catch (Exception e) {
            log.warn("Failed to write audit entry {} '{}' for agent {}", type, action, agentId, e);
        }
    }

    public void whatsapp(Long agentId, SystemLog.Type type, String action, Map<String, ?> details, String phoneNumber) {
        record(agentId, type, action, details, phoneNumber, SystemLog.Source.WHATSAPP);
    }

    private String toJson(Map<String, ?> details) throws JsonProcessingException {
        if (details == null || details.isEmpty()) {
            return null;
        }
        return mapper.writeValueAsString(details);
    }
}
