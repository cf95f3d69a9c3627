package com.ai.autoreply.client;

import com.ai.autoreply.dto.ChatTurn;
import com.ai.autoreply.dto.CompletionResult;
import com.ai.autoreply.dto.UserContent;

import java.util.List;
import java.util.Map;

/**
 * Language model operations: chat completion with optional tools, speech transcription, speech synthesis
 * and image description.
 * Every method throws {@link com.ai.autoreply.exception.CompletionException} on failure.
 */
public interface CompletionClient {

    CompletionResult completeChat(String model, String systemPrompt, List<ChatTurn> history,
                                  UserContent userContent, List<Map<String, Object>> tools);

    String transcribe(byte[] audio, String mimeType);

    /**
     * @return MP3 audio of {@code text} read in {@code voice}
     */
    byte[] speak(String text, String voice);

    String describeImage(String model, String imageBase64, String prompt);
}
