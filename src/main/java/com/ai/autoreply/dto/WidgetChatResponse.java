package com.ai.autoreply.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class WidgetChatResponse {

    private final String response;
    private final String sessionId;
    private final boolean faq;
}
