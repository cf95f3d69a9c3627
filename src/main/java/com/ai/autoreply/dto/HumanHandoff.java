package com.ai.autoreply.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Payload of a {@code notify_human} tool call, handed to the operator notification channel.
 */
@Getter
@Builder
@ToString
public class HumanHandoff {

    private final String reason;
    private final String conversationHistory;
    private final String orderDetails;
    private final String customerName;
    private final String customerPhone;
}
