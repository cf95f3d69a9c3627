package com.ai.autoreply.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Current user message, optionally with an image for multimodal input.
 */
@Getter
@AllArgsConstructor
public class UserContent {

    private final String text;
    private final String imageBase64;

    public static UserContent text(String text) {
        return new UserContent(text, null);
    }

    public boolean hasImage() {
        return imageBase64 != null && !imageBase64.isEmpty();
    }
}
