package com.ai.autoreply.client;

import com.ai.autoreply.dto.ConnectionState;
import com.ai.autoreply.exception.GatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Evolution API (WhatsApp) client over REST.
 */
public class EvolutionGatewayClient implements GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(EvolutionGatewayClient.class);

    private static final String BASE64_MARKER = "base64,";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final GatewayCredentials credentials;

    public EvolutionGatewayClient(RestTemplate restTemplate, ObjectMapper mapper, GatewayCredentials credentials) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.credentials = credentials;
    }

    @Override
    public void sendText(String instance, String phoneNumber, String text) {
        if (StringUtils.isBlank(text)) {
            return;
        }
        Map<String, Object> body = new HashMap<>();
        body.put("number", phoneNumber);
        body.put("text", text);
        post("/message/sendText/" + instance, body, "sendText to " + phoneNumber);
    }

    @Override
    public void sendMedia(String instance, String phoneNumber, String fileData, String mimeType, String caption) {
        Map<String, Object> body = new HashMap<>();
        body.put("number", phoneNumber);
        body.put("mediatype", mediaTypeOf(mimeType));
        body.put("mimetype", mimeType);
        body.put("media", fileData);
        body.put("caption", caption != null ? caption : "");
        post("/message/sendMedia/" + instance, body, "sendMedia to " + phoneNumber);
    }

    @Override
    public void sendAudio(String instance, String phoneNumber, String audioBase64) {
        Map<String, Object> body = new HashMap<>();
        body.put("number", phoneNumber);
        body.put("audio", audioBase64);
        post("/message/sendWhatsAppAudio/" + instance, body, "sendAudio to " + phoneNumber);
    }

    @Override
    public ConnectionState getConnectionState(String instance) {
        String url = credentials.getApiUrl() + "/instance/connectionState/" + instance;
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(headers()), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}"));
            String state = root.path("instance").path("state").asText(root.path("state").asText("unknown"));
            boolean connected = "open".equals(state) || "connected".equals(state);
            return new ConnectionState(instance, state, connected);
        } catch (RestClientException e) {
            throw new GatewayException("connectionState failed for instance " + instance, e);
        } catch (Exception e) {
            throw new GatewayException("Unreadable connectionState response for instance " + instance, e);
        }
    }

    @Override
    public Optional<String> downloadMediaBase64(String instance, String messageId) {
        Map<String, Object> key = new HashMap<>();
        key.put("id", messageId);
        Map<String, Object> body = new HashMap<>();
        body.put("message", Map.of("key", key));
        body.put("convertToMp4", false);

        String responseBody = post("/chat/getBase64FromMediaMessage/" + instance, body, "media download " + messageId);
        if (StringUtils.isBlank(responseBody)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (Exception e) {
            // Some gateway versions answer with the bare base64 string.
            return Optional.ofNullable(cleanBase64(responseBody));
        }
        String raw = extractBase64(root);
        if (raw == null) {
            log.warn("Media download for {} returned no base64, fields={}", messageId, fieldNames(root));
            return Optional.empty();
        }
        return Optional.ofNullable(cleanBase64(raw));
    }

    /**
     * Finds the base64 payload across the response shapes gateway versions use.
     */
    static String extractBase64(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.path("base64").isTextual()) return node.path("base64").asText();
        if (node.path("data").path("base64").isTextual()) return node.path("data").path("base64").asText();
        if (node.path("data").isTextual()) return node.path("data").asText();
        return null;
    }

    static String cleanBase64(String raw) {
        if (raw == null) return null;
        String b64 = raw.trim();
        int marker = b64.indexOf(BASE64_MARKER);
        if (b64.startsWith("data:") && marker != -1) {
            b64 = b64.substring(marker + BASE64_MARKER.length());
        }
        b64 = b64.replaceAll("\\s+", "");
        return b64.isEmpty() ? null : b64;
    }

    static String mediaTypeOf(String mimeType) {
        String mime = StringUtils.defaultString(mimeType).toLowerCase();
        if (mime.startsWith("video")) return "video";
        if (mime.startsWith("image")) return "image";
        if (mime.startsWith("audio")) return "audio";
        return "document";
    }

    private String post(String path, Map<String, Object> body, String operation) {
        String url = credentials.getApiUrl() + path;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers()), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new GatewayException("Gateway " + operation + " returned " + response.getStatusCode());
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new GatewayException("Gateway " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("apikey", credentials.getApiKey());
        return headers;
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        node.fieldNames().forEachRemaining(name -> {
            if (sb.length() > 0) sb.append(',');
            sb.append(name);
        });
        return sb.toString();
    }
}
