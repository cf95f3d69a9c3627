package com.ai.autoreply.conversation;

import org.apache.commons.lang3.StringUtils;

/**
 * Canonical text of one inbound message. A degraded value carries a placeholder
 * produced after a media download, transcription or vision failure.
 */
public final class NormalizedContent {

    private static final NormalizedContent EMPTY = new NormalizedContent(ContentKind.TEXT, "", false, null);

    private final ContentKind kind;
    private final String text;
    private final boolean degraded;
    private final String imageBase64;

    private NormalizedContent(ContentKind kind, String text, boolean degraded, String imageBase64) {
        this.kind = kind;
        this.text = text != null ? text : "";
        this.degraded = degraded;
        this.imageBase64 = imageBase64;
    }

    public static NormalizedContent text(ContentKind kind, String text) {
        return new NormalizedContent(kind, text, false, null);
    }

    public static NormalizedContent image(String text, String imageBase64) {
        return new NormalizedContent(ContentKind.IMAGE, text, false, imageBase64);
    }

    public static NormalizedContent degraded(ContentKind kind, String placeholder) {
        return new NormalizedContent(kind, placeholder, true, null);
    }

    public static NormalizedContent empty() {
        return EMPTY;
    }

    public ContentKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isAudio() {
        return kind == ContentKind.AUDIO;
    }

    public boolean isEmpty() {
        return StringUtils.isBlank(text);
    }

    /** Raw image bytes (base64) for multimodal prompting, or null. */
    public String getImageBase64() {
        return imageBase64;
    }

    @Override
    public String toString() {
        return "NormalizedContent{kind=" + kind + ", degraded=" + degraded + ", length=" + text.length() + "}";
    }
}
