package com.ai.autoreply.service;

import com.ai.autoreply.client.CompletionClient;
import com.ai.autoreply.client.CompletionClientFactory;
import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ContentKind;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.dto.WebhookEvent;
import com.ai.autoreply.entity.Agent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Optional;

/**
 * Turns one inbound payload into the canonical text the model sees.
 * Precedence is image, document, audio, text; kinds the agent disabled are skipped.
 * Media failures never escape: they become degraded placeholders.
 */
@Service
public class ContentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ContentNormalizer.class);

    private static final String DEFAULT_DOCUMENT_NAME = "document";

    private final GatewayClientFactory gatewayClientFactory;
    private final CompletionClientFactory completionClientFactory;
    private final ResponsePhrases phrases;

    public ContentNormalizer(GatewayClientFactory gatewayClientFactory,
                             CompletionClientFactory completionClientFactory,
                             ResponsePhrases phrases) {
        this.gatewayClientFactory = gatewayClientFactory;
        this.completionClientFactory = completionClientFactory;
        this.phrases = phrases;
    }

    public NormalizedContent normalize(Agent agent, WebhookEvent event) {
        WebhookEvent.MessageBody body = event.message();
        if (body == null) {
            return NormalizedContent.empty();
        }
        if (body.getImageMessage() != null && agent.isImageEnabled()) {
            return image(agent, event, body.getImageMessage());
        }
        if (body.getDocumentMessage() != null && agent.isDocumentEnabled()) {
            return document(agent, event, body.getDocumentMessage());
        }
        if (body.getAudioMessage() != null && agent.isAudioEnabled()) {
            return audio(agent, event, body.getAudioMessage());
        }
        String text = body.plainText();
        return StringUtils.isBlank(text) ? NormalizedContent.empty() : NormalizedContent.text(ContentKind.TEXT, text);
    }

    private NormalizedContent image(Agent agent, WebhookEvent event, WebhookEvent.Media media) {
        String caption = StringUtils.trimToNull(media.getCaption());
        try {
            Optional<String> base64 = download(agent, event);
            if (base64.isEmpty()) {
                return degradedImage(caption);
            }
            String prompt = caption != null ? phrases.captionVisionPrompt(caption) : phrases.defaultVisionPrompt();
            String analysis = completion(agent).describeImage(completionClientFactory.modelFor(agent), base64.get(), prompt);
            if (StringUtils.isBlank(analysis)) {
                return degradedImage(caption);
            }
            String text = caption != null
                    ? phrases.imageWithCaption(caption, analysis)
                    : phrases.imageWithoutCaption(analysis);
            return NormalizedContent.image(text, base64.get());
        } catch (Exception e) {
            log.warn("Image analysis failed for message {}: {}", event.messageId(), e.getMessage());
            return degradedImage(caption);
        }
    }

    private NormalizedContent degradedImage(String caption) {
        String placeholder = phrases.imagePlaceholder();
        return NormalizedContent.degraded(ContentKind.IMAGE, caption != null ? placeholder + "\n\n" + caption : placeholder);
    }

    private NormalizedContent document(Agent agent, WebhookEvent event, WebhookEvent.Media media) {
        String fileName = StringUtils.firstNonBlank(media.getFileName(), media.getTitle(), DEFAULT_DOCUMENT_NAME);
        String mime = StringUtils.defaultString(media.getMimetype()).toLowerCase();

        if (mime.startsWith("image/")) {
            try {
                Optional<String> base64 = download(agent, event);
                if (base64.isPresent()) {
                    String analysis = completion(agent).describeImage(completionClientFactory.modelFor(agent),
                            base64.get(), phrases.documentVisionPrompt());
                    if (StringUtils.isNotBlank(analysis)) {
                        return NormalizedContent.text(ContentKind.DOCUMENT, phrases.documentImageAnalysis(fileName, analysis));
                    }
                }
            } catch (Exception e) {
                log.warn("Document image analysis failed for message {}: {}", event.messageId(), e.getMessage());
            }
            return NormalizedContent.degraded(ContentKind.DOCUMENT, phrases.documentReceived(fileName));
        }
        if (mime.contains("pdf")) {
            return NormalizedContent.text(ContentKind.DOCUMENT, withCaption(phrases.pdfReceived(fileName), media.getCaption()));
        }
        return NormalizedContent.text(ContentKind.DOCUMENT, withCaption(phrases.documentReceived(fileName), media.getCaption()));
    }

    private NormalizedContent audio(Agent agent, WebhookEvent event, WebhookEvent.Media media) {
        String mime = StringUtils.substringBefore(StringUtils.defaultIfBlank(media.getMimetype(), "audio/ogg"), ";").trim();
        try {
            Optional<String> base64 = download(agent, event);
            if (base64.isEmpty()) {
                return NormalizedContent.degraded(ContentKind.AUDIO, phrases.audioPlaceholder());
            }
            byte[] audio = Base64.getDecoder().decode(base64.get());
            String transcript = completion(agent).transcribe(audio, mime);
            if (StringUtils.isBlank(transcript)) {
                return NormalizedContent.degraded(ContentKind.AUDIO, phrases.audioPlaceholder());
            }
            log.info("Transcribed audio {} ({} bytes, {})", event.messageId(), audio.length, mime);
            return NormalizedContent.text(ContentKind.AUDIO, transcript);
        } catch (Exception e) {
            log.warn("Audio transcription failed for message {}: {}", event.messageId(), e.getMessage());
            return NormalizedContent.degraded(ContentKind.AUDIO, phrases.audioPlaceholder());
        }
    }

    private Optional<String> download(Agent agent, WebhookEvent event) {
        return gatewayClientFactory.forAgent(agent).downloadMediaBase64(agent.getInstanceName(), event.messageId());
    }

    private CompletionClient completion(Agent agent) {
        return completionClientFactory.forAgent(agent);
    }

    private static String withCaption(String text, String caption) {
        return StringUtils.isBlank(caption) ? text : text + "\n\n" + caption.trim();
    }
}
