package com.ai.autoreply.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One prior message as the completion service sees it ({@code user} or {@code assistant}).
 */
@Getter
@ToString
@AllArgsConstructor
public class ChatTurn {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;
}
