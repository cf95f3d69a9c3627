package com.ai.autoreply.conversation;

public enum ContentKind {
    TEXT,
    AUDIO,
    IMAGE,
    DOCUMENT
}
