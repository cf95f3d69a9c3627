package com.ai.autoreply.client;

import lombok.Builder;
import lombok.Value;

/**
 * Request tuning shared by every OpenAI client regardless of tenant.
 */
@Value
@Builder
public class OpenAiSettings {

    @Builder.Default
    int maxCompletionTokens = 1000;

    @Builder.Default
    String transcriptionModel = "whisper-1";

    /** ISO-639-1 hint for transcription, blank to let the model detect it. */
    @Builder.Default
    String transcriptionLanguage = "pt";

    @Builder.Default
    String speechModel = "tts-1";

    @Builder.Default
    int maxRetries = 3;
}
