package com.ai.autoreply.client;

import lombok.Value;

@Value
public class GatewayCredentials {

    String apiUrl;
    String apiKey;

    @Override
    public String toString() {
        return "GatewayCredentials{apiUrl=" + apiUrl + "}";
    }
}
