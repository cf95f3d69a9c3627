package com.ai.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Body returned to the gateway for every webhook call.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookOutcome {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_IGNORED = "ignored";

    private final String status;
    private final String reason;
    private final String messageId;
    private final Long remainingSeconds;
    private final Integer messagesSent;
    private final Integer mediaSent;
    private final Boolean takeover;

    public static WebhookOutcome ignored(String reason) {
        return WebhookOutcome.builder().status(STATUS_IGNORED).reason(reason).build();
    }

    public boolean isIgnored() {
        return STATUS_IGNORED.equals(status);
    }
}
