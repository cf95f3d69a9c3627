package com.ai.autoreply.client;

import com.ai.autoreply.dto.ChatTurn;
import com.ai.autoreply.dto.CompletionResult;
import com.ai.autoreply.dto.ToolCall;
import com.ai.autoreply.dto.UserContent;
import com.ai.autoreply.exception.CompletionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions, Whisper transcription, text-to-speech and vision over REST.
 */
public class OpenAiCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionClient.class);

    static final String DEFAULT_VOICE = "nova";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final CompletionCredentials credentials;
    private final OpenAiSettings settings;

    public OpenAiCompletionClient(RestTemplate restTemplate, ObjectMapper mapper,
                                  CompletionCredentials credentials, OpenAiSettings settings) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.credentials = credentials;
        this.settings = settings;
    }

    @Override
    public CompletionResult completeChat(String model, String systemPrompt, List<ChatTurn> history,
                                         UserContent userContent, List<Map<String, Object>> tools) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        if (history != null) {
            for (ChatTurn turn : history) {
                messages.add(message(turn.getRole(), turn.getContent()));
            }
        }
        messages.add(message(ChatTurn.USER, userContentPayload(userContent)));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_completion_tokens", settings.getMaxCompletionTokens());
        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools);
            body.put("tool_choice", "auto");
        }

        JsonNode root = postJson("/chat/completions", body, "chat completion");
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new CompletionException("Chat completion returned no choices");
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(new ToolCall(call.path("id").asText(""),
                    function.path("name").asText(""),
                    function.path("arguments").asText("{}")));
        }
        String text = message.path("content").isTextual() ? message.path("content").asText() : "";
        log.debug("Completion model={} toolCalls={} textLength={}", model, toolCalls.size(), text.length());
        return new CompletionResult(text, toolCalls);
    }

    @Override
    public String transcribe(byte[] audio, String mimeType) {
        if (audio == null || audio.length == 0) {
            throw new CompletionException("No audio to transcribe");
        }
        String fileName = fileNameFor(mimeType);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credentials.getApiKey());
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("model", settings.getTranscriptionModel());
        form.add("response_format", "json");
        if (StringUtils.isNotBlank(settings.getTranscriptionLanguage())) {
            form.add("language", settings.getTranscriptionLanguage());
        }
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return fileName;
            }
        });

        HttpEntity<MultiValueMap<String, Object>> request = new HttpEntity<>(form, headers);
        String url = credentials.getBaseUrl() + "/audio/transcriptions";

        ResponseEntity<String> response = null;
        for (int attempt = 1; attempt <= settings.getMaxRetries(); attempt++) {
            try {
                response = restTemplate.postForEntity(url, request, String.class);
                break;
            } catch (ResourceAccessException e) {
                if (attempt == settings.getMaxRetries()) {
                    throw new CompletionException("Transcription failed after " + attempt + " attempts", e);
                }
                long delayMs = 1000L * attempt;
                log.warn("Transcription attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, settings.getMaxRetries(), e.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException("Transcription retry interrupted", ie);
                }
            } catch (HttpClientErrorException.Unauthorized e) {
                throw new CompletionException("OpenAI rejected the API key (401)", e);
            } catch (RestClientException e) {
                throw new CompletionException("Transcription failed: " + e.getMessage(), e);
            }
        }
        if (response == null) {
            throw new CompletionException("Transcription produced no response");
        }
        return readTree(response.getBody(), "transcription").path("text").asText("").trim();
    }

    @Override
    public byte[] speak(String text, String voice) {
        if (StringUtils.isBlank(text)) {
            throw new CompletionException("No text to synthesize");
        }
        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getSpeechModel());
        body.put("voice", StringUtils.defaultIfBlank(voice, DEFAULT_VOICE));
        body.put("input", text);
        body.put("response_format", "mp3");

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credentials.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(credentials.getBaseUrl() + "/audio/speech",
                    new HttpEntity<>(body, headers), byte[].class);
            byte[] audio = response.getBody();
            if (audio == null || audio.length == 0) {
                throw new CompletionException("Speech synthesis returned no audio");
            }
            log.debug("Speech voice={} textLength={} bytes={}", body.get("voice"), text.length(), audio.length);
            return audio;
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new CompletionException("OpenAI rejected the API key (401)", e);
        } catch (RestClientException e) {
            throw new CompletionException("OpenAI speech synthesis failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describeImage(String model, String imageBase64, String prompt) {
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("type", "text", "text", prompt));
        parts.add(Map.of("type", "image_url", "image_url", Map.of("url", dataUrl(imageBase64))));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", List.of(message(ChatTurn.USER, parts)));
        body.put("max_completion_tokens", settings.getMaxCompletionTokens());

        JsonNode root = postJson("/chat/completions", body, "image description");
        return root.path("choices").path(0).path("message").path("content").asText("").trim();
    }

    /**
     * Whisper infers the container from the file extension.
     */
    static String fileNameFor(String mimeType) {
        String mime = StringUtils.defaultString(mimeType).toLowerCase();
        if (mime.contains("mp3") || mime.contains("mpeg")) return "audio.mp3";
        if (mime.contains("mp4") || mime.contains("m4a")) return "audio.m4a";
        if (mime.contains("wav")) return "audio.wav";
        if (mime.contains("webm")) return "audio.webm";
        return "audio.ogg";
    }

    private Object userContentPayload(UserContent userContent) {
        String text = userContent != null ? StringUtils.defaultString(userContent.getText()) : "";
        if (userContent == null || !userContent.hasImage()) {
            return text;
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("type", "text", "text", text));
        parts.add(Map.of("type", "image_url", "image_url", Map.of("url", dataUrl(userContent.getImageBase64()))));
        return parts;
    }

    private static String dataUrl(String base64) {
        return "data:image/jpeg;base64," + base64;
    }

    private static Map<String, Object> message(String role, Object content) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    private JsonNode postJson(String path, Map<String, Object> body, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credentials.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(credentials.getBaseUrl() + path,
                    new HttpEntity<>(body, headers), String.class);
            return readTree(response.getBody(), operation);
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new CompletionException("OpenAI rejected the API key (401)", e);
        } catch (RestClientException e) {
            throw new CompletionException("OpenAI " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String body, String operation) {
        try {
            return mapper.readTree(StringUtils.defaultIfBlank(body, "{}"));
        } catch (Exception e) {
            throw new CompletionException("Unreadable OpenAI " + operation + " response", e);
        }
    }
}
