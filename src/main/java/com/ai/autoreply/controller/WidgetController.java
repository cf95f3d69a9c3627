package com.ai.autoreply.controller;

import com.ai.autoreply.dto.WidgetChatRequest;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.service.WidgetChatService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/widget")
public class WidgetController {

    private final WidgetChatService widgetChatService;

    public WidgetController(WidgetChatService widgetChatService) {
        this.widgetChatService = widgetChatService;
    }

    @PostMapping("/chat/{agentId}")
    public ResponseEntity<?> chat(@PathVariable Long agentId, @RequestBody(required = false) WidgetChatRequest request) {
        if (request == null || StringUtils.isBlank(request.getMessage())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message is required"));
        }
        Optional<Agent> agent = widgetChatService.findWidgetAgent(agentId);
        if (agent.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Agent not found or widget not enabled"));
        }
        return ResponseEntity.ok(widgetChatService.chat(agent.get(), request.getMessage(), request.getSessionId()));
    }
}
