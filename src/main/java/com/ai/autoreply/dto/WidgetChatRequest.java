package com.ai.autoreply.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class WidgetChatRequest {

    private String message;
    private String sessionId;
}
