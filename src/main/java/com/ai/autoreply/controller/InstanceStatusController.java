package com.ai.autoreply.controller;

import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.repository.AgentRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/instances")
public class InstanceStatusController {

    private final AgentRepository agentRepository;
    private final GatewayClientFactory gatewayClientFactory;

    public InstanceStatusController(AgentRepository agentRepository, GatewayClientFactory gatewayClientFactory) {
        this.agentRepository = agentRepository;
        this.gatewayClientFactory = gatewayClientFactory;
    }

    @GetMapping("/{agentId}/state")
    public ResponseEntity<?> state(@PathVariable Long agentId) {
        Optional<Agent> agent = agentRepository.findById(agentId);
        if (agent.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Agent not found"));
        }
        return ResponseEntity.ok(gatewayClientFactory.forAgent(agent.get())
                .getConnectionState(agent.get().getInstanceName()));
    }
}
