package com.ai.autoreply.client;

import com.ai.autoreply.dto.ConnectionState;

import java.util.Optional;

/**
 * Messaging gateway bound to one set of credentials.
 */
public interface GatewayClient {

    void sendText(String instance, String phoneNumber, String text);

    /**
     * @param fileData base64 payload or an http(s) URL the gateway can fetch
     */
    void sendMedia(String instance, String phoneNumber, String fileData, String mimeType, String caption);

    /**
     * Sends a voice note.
     *
     * @param audioBase64 base64-encoded audio, no data-URL prefix
     */
    void sendAudio(String instance, String phoneNumber, String audioBase64);

    ConnectionState getConnectionState(String instance);

    /**
     * Downloads the media attached to a received message. Empty when the gateway returned no payload.
     */
    Optional<String> downloadMediaBase64(String instance, String messageId);
}
