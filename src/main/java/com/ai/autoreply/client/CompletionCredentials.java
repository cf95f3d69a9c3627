package com.ai.autoreply.client;

import lombok.Value;

@Value
public class CompletionCredentials {

    String apiKey;
    String baseUrl;

    @Override
    public String toString() {
        return "CompletionCredentials{baseUrl=" + baseUrl + "}";
    }
}
