package com.ai.autoreply.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ConnectionState {

    private final String instance;
    private final String state;
    private final boolean connected;
}
