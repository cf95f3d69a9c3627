package com.ai.autoreply.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ToolCall {

    private final String id;
    private final String name;
    /** Raw JSON arguments as returned by the model. */
    private final String arguments;
}
