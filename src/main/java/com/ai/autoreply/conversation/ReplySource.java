package com.ai.autoreply.conversation;

/**
 * Where the outbound reply text came from.
 */
public enum ReplySource {
    MODEL,
    MEDIA,
    MEDIA_NOT_FOUND,
    HANDOFF,
    FALLBACK
}
