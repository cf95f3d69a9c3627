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
 * Hands out completion clients keyed by the API key an agent resolves to.
 */
@Component
public class CompletionClientFactory {

    private final CredentialResolver credentialResolver;
    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final OpenAiSettings settings;
    private final Map<CompletionCredentials, CompletionClient> clients = new ConcurrentHashMap<>();

    public CompletionClientFactory(CredentialResolver credentialResolver,
                                   RestTemplateBuilder builder,
                                   ObjectMapper mapper,
                                   @Value("${openai.connect-timeout:30s}") Duration connectTimeout,
                                   @Value("${openai.read-timeout:120s}") Duration readTimeout,
                                   @Value("${openai.max-completion-tokens:1000}") int maxCompletionTokens,
                                   @Value("${openai.transcription-model:whisper-1}") String transcriptionModel,
                                   @Value("${openai.transcription-language:pt}") String transcriptionLanguage,
                                   @Value("${openai.speech-model:tts-1}") String speechModel,
                                   @Value("${openai.max-retries:3}") int maxRetries) {
        this.credentialResolver = credentialResolver;
        this.mapper = mapper;
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        this.settings = OpenAiSettings.builder()
                .maxCompletionTokens(maxCompletionTokens)
                .transcriptionModel(transcriptionModel)
                .transcriptionLanguage(transcriptionLanguage)
                .speechModel(speechModel)
                .maxRetries(Math.max(1, maxRetries))
                .build();
    }

    public CompletionClient forAgent(Agent agent) {
        CompletionCredentials credentials = credentialResolver.completionCredentials(agent);
        return clients.computeIfAbsent(credentials,
                c -> new OpenAiCompletionClient(restTemplate, mapper, c, settings));
    }

    /**
     * Model for the agent, falling back to the configured default.
     */
    public String modelFor(Agent agent) {
        return credentialResolver.modelFor(agent);
    }
}
