package com.ai.autoreply.client;

import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.service.CredentialResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out gateway clients keyed by the credentials an agent resolves to.
 */
@Component
public class GatewayClientFactory {

    private final CredentialResolver credentialResolver;
    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final Map<GatewayCredentials, GatewayClient> clients = new ConcurrentHashMap<>();

    public GatewayClientFactory(CredentialResolver credentialResolver,
                                RestTemplateBuilder builder,
                                ObjectMapper mapper,
                                @Value("${evolution.connect-timeout:10s}") Duration connectTimeout,
                                @Value("${evolution.read-timeout:60s}") Duration readTimeout) {
        this.credentialResolver = credentialResolver;
        this.mapper = mapper;
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    public GatewayClient forAgent(Agent agent) {
        GatewayCredentials credentials = credentialResolver.gatewayCredentials(agent);
        return clients.computeIfAbsent(credentials,
                c -> new EvolutionGatewayClient(restTemplate, mapper, c));
    }
}
