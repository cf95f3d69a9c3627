package com.ai.autoreply.service;

import com.ai.autoreply.client.CompletionCredentials;
import com.ai.autoreply.client.GatewayCredentials;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.Setting;
import com.ai.autoreply.exception.CredentialsNotConfiguredException;
import com.ai.autoreply.repository.SettingRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Resolves collaborator credentials: agent fields first, then properties/environment, then the settings table.
 */
@Service
public class CredentialResolver {

    static final String OPENAI_API_KEY = "openai_api_key";
    static final String EVOLUTION_API_URL = "evolution_api_url";
    static final String EVOLUTION_API_KEY = "evolution_api_key";

    private static final String MANAGER_SUFFIX = "/manager";

    private final SettingRepository settingRepository;
    private final String openAiApiKey;
    private final String openAiBaseUrl;
    private final String openAiModel;
    private final String evolutionApiUrl;
    private final String evolutionApiKey;

    public CredentialResolver(SettingRepository settingRepository,
                              @Value("${openai.api-key:${OPENAI_API_KEY:}}") String openAiApiKey,
                              @Value("${openai.base-url:https://api.openai.com/v1}") String openAiBaseUrl,
                              @Value("${openai.model:gpt-4o}") String openAiModel,
                              @Value("${evolution.api-url:${EVOLUTION_API_URL:}}") String evolutionApiUrl,
                              @Value("${evolution.api-key:${EVOLUTION_API_KEY:}}") String evolutionApiKey) {
        this.settingRepository = settingRepository;
        this.openAiApiKey = openAiApiKey;
        this.openAiBaseUrl = StringUtils.removeEnd(openAiBaseUrl, "/");
        this.openAiModel = openAiModel;
        this.evolutionApiUrl = evolutionApiUrl;
        this.evolutionApiKey = evolutionApiKey;
    }

    public CompletionCredentials completionCredentials(Agent agent) {
        String apiKey = firstNonBlank(agent != null ? agent.getOpenaiApiKey() : null, openAiApiKey, OPENAI_API_KEY);
        if (StringUtils.isBlank(apiKey)) {
            throw new CredentialsNotConfiguredException("OpenAI API key is not configured");
        }
        return new CompletionCredentials(apiKey.trim(), openAiBaseUrl);
    }

    public GatewayCredentials gatewayCredentials(Agent agent) {
        String url;
        String key;
        if (agent != null && StringUtils.isNoneBlank(agent.getEvolutionApiUrl(), agent.getEvolutionApiKey())) {
            url = agent.getEvolutionApiUrl();
            key = agent.getEvolutionApiKey();
        } else {
            url = firstNonBlank(null, evolutionApiUrl, EVOLUTION_API_URL);
            key = firstNonBlank(null, evolutionApiKey, EVOLUTION_API_KEY);
        }
        if (StringUtils.isAnyBlank(url, key)) {
            throw new CredentialsNotConfiguredException("Evolution API credentials are not configured");
        }
        return new GatewayCredentials(normalizeGatewayUrl(url), key.trim());
    }

    public String modelFor(Agent agent) {
        return agent != null && StringUtils.isNotBlank(agent.getOpenaiModel()) ? agent.getOpenaiModel() : openAiModel;
    }

    /**
     * The manager UI path is sometimes pasted in place of the API base URL.
     */
    static String normalizeGatewayUrl(String url) {
        String normalized = StringUtils.removeEnd(url.trim(), "/");
        normalized = StringUtils.removeEnd(normalized, MANAGER_SUFFIX);
        return StringUtils.removeEnd(normalized, "/");
    }

    private String firstNonBlank(String agentValue, String propertyValue, String settingKey) {
        if (StringUtils.isNotBlank(agentValue)) return agentValue;
        if (StringUtils.isNotBlank(propertyValue)) return propertyValue;
        return settingRepository.findByKey(settingKey)
                .map(Setting::getValue)
                .filter(StringUtils::isNotBlank)
                .orElse(null);
    }
}
