package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.exception.GatewayException;
import com.ai.autoreply.exception.PartialDeliveryException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Splits a reply into short chat messages and sends them with a typing-like pause in between.
 */
@Service
public class MessagePacer {

    private static final Logger log = LoggerFactory.getLogger(MessagePacer.class);

    static final int SINGLE_MESSAGE_LIMIT = 300;
    static final int PARAGRAPH_CHUNK_LIMIT = 400;
    static final int SENTENCE_CHUNK_LIMIT = 350;

    private static final Pattern DELIMITER = Pattern.compile("(?m)^\\s*---\\s*$");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private final long minDelayMs;
    private final long maxDelayMs;

    public MessagePacer(@Value("${autoreply.pacer.min-delay-ms:800}") long minDelayMs,
                        @Value("${autoreply.pacer.max-delay-ms:1200}") long maxDelayMs) {
        this.minDelayMs = Math.max(0, minDelayMs);
        this.maxDelayMs = Math.max(this.minDelayMs, maxDelayMs);
    }

    public List<String> split(String reply) {
        if (StringUtils.isBlank(reply)) {
            return Collections.emptyList();
        }
        List<String> chunks = new ArrayList<>();
        for (String part : DELIMITER.split(reply)) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.length() <= SINGLE_MESSAGE_LIMIT) {
                chunks.add(trimmed);
                continue;
            }
            List<String> paragraphs = nonBlank(PARAGRAPH_BREAK.split(trimmed));
            if (paragraphs.size() > 1) {
                chunks.addAll(pack(paragraphs, PARAGRAPH_CHUNK_LIMIT, "\n\n"));
            } else {
                chunks.addAll(pack(nonBlank(SENTENCE_END.split(trimmed)), SENTENCE_CHUNK_LIMIT, " "));
            }
        }
        return chunks;
    }

    /**
     * Sends the chunks in order. Stops early if the thread is interrupted; chunks already sent stay sent.
     *
     * @return number of chunks delivered
     * @throws PartialDeliveryException when the gateway rejects a chunk, carrying the count sent before it
     */
    public int deliver(GatewayClient gateway, String instance, String phoneNumber, List<String> chunks) {
        int sent = 0;
        for (String chunk : chunks) {
            if (sent > 0 && !pause()) {
                log.warn("Delivery to {} interrupted after {}/{} chunks", phoneNumber, sent, chunks.size());
                break;
            }
            try {
                gateway.sendText(instance, phoneNumber, chunk);
            } catch (GatewayException e) {
                throw new PartialDeliveryException(sent, e);
            }
            sent++;
        }
        return sent;
    }

    private boolean pause() {
        long delay = maxDelayMs > minDelayMs
                ? ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1)
                : minDelayMs;
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Greedily joins adjacent pieces while the result stays within {@code limit}. */
    private static List<String> pack(List<String> pieces, int limit, String separator) {
        List<String> packed = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : pieces) {
            if (current.length() > 0 && current.length() + separator.length() + piece.length() > limit) {
                packed.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) current.append(separator);
            current.append(piece);
        }
        if (current.length() > 0) {
            packed.add(current.toString());
        }
        return packed;
    }

    private static List<String> nonBlank(String[] parts) {
        List<String> result = new ArrayList<>();
        for (String part : parts) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return result;
    }
}
