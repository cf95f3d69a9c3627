package com.ai.autoreply.service;

import com.ai.autoreply.client.CompletionClient;
import com.ai.autoreply.client.CompletionClientFactory;
import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ContentKind;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.dto.WebhookEvent;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.exception.CompletionException;
import com.ai.autoreply.exception.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ContentNormalizerTest {

    private static final String AUDIO_B64 = Base64.getEncoder().encodeToString("ogg-bytes".getBytes(StandardCharsets.UTF_8));
    private static final String IMAGE_B64 = "aW1hZ2U=";

    private final ResponsePhrases phrases = new ResponsePhrases();
    private GatewayClientFactory gatewayClientFactory;
    private GatewayClient gateway;
    private CompletionClient completion;
    private ContentNormalizer normalizer;
    private Agent agent;

    @BeforeEach
    void setUp() {
        gatewayClientFactory = mock(GatewayClientFactory.class);
        gateway = mock(GatewayClient.class);
        CompletionClientFactory completionClientFactory = mock(CompletionClientFactory.class);
        completion = mock(CompletionClient.class);
        when(gatewayClientFactory.forAgent(any())).thenReturn(gateway);
        when(completionClientFactory.forAgent(any())).thenReturn(completion);
        when(completionClientFactory.modelFor(any())).thenReturn("gpt-4o");

        normalizer = new ContentNormalizer(gatewayClientFactory, completionClientFactory, phrases);
        agent = Agent.builder().id(1L).name("Store").prompt("p").instanceName("store").build();
    }

    @Test
    void plainTextPassesThrough() {
        WebhookEvent.MessageBody body = new WebhookEvent.MessageBody();
        body.setConversation("Do you deliver?");

        NormalizedContent content = normalizer.normalize(agent, event(body));

        assertThat(content.getKind()).isEqualTo(ContentKind.TEXT);
        assertThat(content.getText()).isEqualTo("Do you deliver?");
        assertThat(content.isDegraded()).isFalse();
        verifyNoInteractions(gatewayClientFactory);
    }

    @Test
    void extendedTextIsUsedWhenConversationMissing() {
        WebhookEvent.ExtendedText extended = new WebhookEvent.ExtendedText();
        extended.setText("replying to you");
        WebhookEvent.MessageBody body = new WebhookEvent.MessageBody();
        body.setExtendedTextMessage(extended);

        assertThat(normalizer.normalize(agent, event(body)).getText()).isEqualTo("replying to you");
    }

    @Test
    void audioIsTranscribedWithParametersStrippedFromMime() {
        when(gateway.downloadMediaBase64("store", "MSG1")).thenReturn(Optional.of(AUDIO_B64));
        when(completion.transcribe(any(), eq("audio/ogg"))).thenReturn("I'd like a quote");

        NormalizedContent content = normalizer.normalize(agent, event(audio("audio/ogg; codecs=opus")));

        assertThat(content.getKind()).isEqualTo(ContentKind.AUDIO);
        assertThat(content.isAudio()).isTrue();
        assertThat(content.getText()).isEqualTo("I'd like a quote");
        verify(completion).transcribe("ogg-bytes".getBytes(StandardCharsets.UTF_8), "audio/ogg");
    }

    @Test
    void audioDownloadFailureDegradesToPlaceholder() {
        when(gateway.downloadMediaBase64(anyString(), anyString())).thenThrow(new GatewayException("404"));

        NormalizedContent content = normalizer.normalize(agent, event(audio("audio/ogg")));

        assertThat(content.isDegraded()).isTrue();
        assertThat(content.getText()).isEqualTo(phrases.audioPlaceholder());
    }

    @Test
    void transcriptionFailureDegradesToPlaceholder() {
        when(gateway.downloadMediaBase64("store", "MSG1")).thenReturn(Optional.of(AUDIO_B64));
        when(completion.transcribe(any(), anyString())).thenThrow(new CompletionException("rate limited"));

        NormalizedContent content = normalizer.normalize(agent, event(audio("audio/ogg")));

        assertThat(content.isDegraded()).isTrue();
        assertThat(content.getKind()).isEqualTo(ContentKind.AUDIO);
    }

    @Test
    void imageWithCaptionCombinesCaptionAndAnalysis() {
        when(gateway.downloadMediaBase64("store", "MSG1")).thenReturn(Optional.of(IMAGE_B64));
        when(completion.describeImage(eq("gpt-4o"), eq(IMAGE_B64), anyString())).thenReturn("A red generator");

        NormalizedContent content = normalizer.normalize(agent, event(image("How much is this?")));

        assertThat(content.getKind()).isEqualTo(ContentKind.IMAGE);
        assertThat(content.getText()).isEqualTo(phrases.imageWithCaption("How much is this?", "A red generator"));
        assertThat(content.getImageBase64()).isEqualTo(IMAGE_B64);
    }

    @Test
    void imageTakesPrecedenceOverText() {
        when(gateway.downloadMediaBase64("store", "MSG1")).thenReturn(Optional.of(IMAGE_B64));
        when(completion.describeImage(anyString(), anyString(), anyString())).thenReturn("A receipt");
        WebhookEvent.MessageBody body = image(null);
        body.setConversation("ignored text");

        NormalizedContent content = normalizer.normalize(agent, event(body));

        assertThat(content.getText()).isEqualTo(phrases.imageWithoutCaption("A receipt"));
    }

    @Test
    void disabledImageFallsBackToText() {
        agent.setImageEnabled(false);
        WebhookEvent.MessageBody body = image("caption");
        body.setConversation("text alongside");

        NormalizedContent content = normalizer.normalize(agent, event(body));

        assertThat(content.getKind()).isEqualTo(ContentKind.TEXT);
        assertThat(content.getText()).isEqualTo("text alongside");
        verifyNoInteractions(gateway);
    }

    @Test
    void pdfDocumentIsAcknowledgedWithoutDownload() {
        NormalizedContent content = normalizer.normalize(agent, event(document("application/pdf", "invoice.pdf")));

        assertThat(content.getKind()).isEqualTo(ContentKind.DOCUMENT);
        assertThat(content.getText()).isEqualTo(phrases.pdfReceived("invoice.pdf"));
        verify(gateway, never()).downloadMediaBase64(anyString(), anyString());
    }

    @Test
    void imageDocumentGoesThroughVision() {
        when(gateway.downloadMediaBase64("store", "MSG1")).thenReturn(Optional.of(IMAGE_B64));
        when(completion.describeImage(anyString(), anyString(), eq(phrases.documentVisionPrompt()))).thenReturn("A floor plan");

        NormalizedContent content = normalizer.normalize(agent, event(document("image/png", "plan.png")));

        assertThat(content.getText()).isEqualTo(phrases.documentImageAnalysis("plan.png", "A floor plan"));
        assertThat(content.isDegraded()).isFalse();
    }

    @Test
    void otherDocumentTypesGetPlaceholderWithName() {
        NormalizedContent content = normalizer.normalize(agent, event(document("application/zip", "files.zip")));

        assertThat(content.getText()).isEqualTo(phrases.documentReceived("files.zip"));
    }

    @Test
    void missingBodyIsEmpty() {
        WebhookEvent event = event(null);

        assertThat(normalizer.normalize(agent, event).isEmpty()).isTrue();
    }

    private static WebhookEvent event(WebhookEvent.MessageBody body) {
        WebhookEvent.Key key = new WebhookEvent.Key();
        key.setId("MSG1");
        key.setRemoteJid("5511999990000@s.whatsapp.net");
        WebhookEvent.Data data = new WebhookEvent.Data();
        data.setKey(key);
        data.setMessage(body);
        WebhookEvent event = new WebhookEvent();
        event.setData(data);
        return event;
    }

    private static WebhookEvent.MessageBody audio(String mime) {
        WebhookEvent.Media media = new WebhookEvent.Media();
        media.setMimetype(mime);
        WebhookEvent.MessageBody body = new WebhookEvent.MessageBody();
        body.setAudioMessage(media);
        return body;
    }

    private static WebhookEvent.MessageBody image(String caption) {
        WebhookEvent.Media media = new WebhookEvent.Media();
        media.setMimetype("image/jpeg");
        media.setCaption(caption);
        WebhookEvent.MessageBody body = new WebhookEvent.MessageBody();
        body.setImageMessage(media);
        return body;
    }

    private static WebhookEvent.MessageBody document(String mime, String fileName) {
        WebhookEvent.Media media = new WebhookEvent.Media();
        media.setMimetype(mime);
        media.setFileName(fileName);
        WebhookEvent.MessageBody body = new WebhookEvent.MessageBody();
        body.setDocumentMessage(media);
        return body;
    }
}
