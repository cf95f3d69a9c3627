package com.ai.autoreply.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
public class CompletionResult {

    private final String text;
    private final List<ToolCall> toolCalls;

    public CompletionResult(String text, List<ToolCall> toolCalls) {
        this.text = text != null ? text : "";
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : Collections.emptyList();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
