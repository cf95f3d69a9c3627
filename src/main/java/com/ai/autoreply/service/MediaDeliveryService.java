package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.entity.AgentMedia;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.exception.GatewayException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes catalog items to a contact file by file. The first file of an item carries the item name as caption.
 */
@Service
public class MediaDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(MediaDeliveryService.class);

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private final ResponsePhrases phrases;
    private final SystemLogService systemLogService;
    private final long itemDelayMs;
    private final long galleryFileDelayMs;

    public MediaDeliveryService(ResponsePhrases phrases,
                                SystemLogService systemLogService,
                                @Value("${autoreply.media.delay-ms:800}") long itemDelayMs,
                                @Value("${autoreply.media.gallery-delay-ms:500}") long galleryFileDelayMs) {
        this.phrases = phrases;
        this.systemLogService = systemLogService;
        this.itemDelayMs = itemDelayMs;
        this.galleryFileDelayMs = galleryFileDelayMs;
    }

    /**
     * @return number of files the gateway accepted
     */
    public int deliver(GatewayClient gateway, String instance, ConversationKey key, List<AgentMedia> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        int attempted = 0;
        int sent = 0;
        for (int i = 0; i < items.size(); i++) {
            AgentMedia item = items.get(i);
            if (i > 0 && !pause(itemDelayMs)) break;

            List<String> files = item.getFileUrls();
            if (files == null || files.isEmpty()) {
                attempted++;
                log.error("[{}] Media \"{}\" has no files", key, item.getName());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("media", item.getName());
                details.put("error", "no files");
                systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.ERROR,
                        "Media send failed: \"" + item.getName() + "\"", details, key.getPhoneNumber());
                continue;
            }
            for (int f = 0; f < files.size(); f++) {
                if (f > 0 && !pause(galleryFileDelayMs)) break;
                attempted++;
                String caption = f == 0 ? item.getName() : "";
                if (sendFile(gateway, instance, key, item, f, caption)) {
                    sent++;
                }
            }
        }

        if (attempted > 0 && sent == 0) {
            log.warn("[{}] All {} media file(s) failed, sending apology", key, attempted);
            gateway.sendText(instance, key.getPhoneNumber(), phrases.mediaDeliveryFailed());
        }
        log.info("[{}] Media delivered: {}/{} file(s) from {} item(s)", key, sent, attempted, items.size());
        return sent;
    }

    private boolean sendFile(GatewayClient gateway, String instance, ConversationKey key,
                             AgentMedia item, int index, String caption) {
        String fileUrl = item.getFileUrls().get(index);
        String mime = item.mimeTypeAt(index, defaultMimeType(item.getType()));
        try {
            String payload = fileUrl;
            if (StringUtils.startsWith(fileUrl, DATA_URL_PREFIX)) {
                int marker = fileUrl.indexOf(BASE64_MARKER);
                if (marker == -1) {
                    throw new IllegalArgumentException("data URL without base64 payload");
                }
                String embeddedMime = fileUrl.substring(DATA_URL_PREFIX.length(), marker);
                if (StringUtils.isNotBlank(embeddedMime)) {
                    mime = embeddedMime;
                }
                payload = fileUrl.substring(marker + BASE64_MARKER.length());
            } else if (!StringUtils.startsWithAny(fileUrl, "http://", "https://")) {
                throw new IllegalArgumentException("unsupported media reference");
            }
            gateway.sendMedia(instance, key.getPhoneNumber(), payload, mime, caption);
            return true;
        } catch (GatewayException | IllegalArgumentException e) {
            log.error("[{}] Failed to send file {} of media \"{}\": {}", key, index + 1, item.getName(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("media", item.getName());
            details.put("fileIndex", index);
            details.put("error", String.valueOf(e.getMessage()));
            systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.ERROR,
                    "Media send failed: \"" + item.getName() + "\"", details, key.getPhoneNumber());
            return false;
        }
    }

    static String defaultMimeType(AgentMedia.Type type) {
        if (type == null) return "application/octet-stream";
        switch (type) {
            case VIDEO:
                return "video/mp4";
            case DOCUMENT:
                return "application/pdf";
            default:
                return "image/jpeg";
        }
    }

    private static boolean pause(long delayMs) {
        if (delayMs <= 0) return true;
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
