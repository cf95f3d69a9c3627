package com.ai.autoreply.conversation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of the policy chain for one inbound message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PolicyDecision {

    private final PolicyOutcome outcome;
    /** Only set for {@link PolicyOutcome#TAKEOVER_ACTIVE}. */
    private final Long remainingSeconds;
    /** Id of the persisted user message, null for owner messages. */
    private final Long userMessageId;

    public static PolicyDecision terminal(PolicyOutcome outcome, Long userMessageId) {
        return new PolicyDecision(outcome, null, userMessageId);
    }

    public static PolicyDecision takeoverActive(long remainingSeconds, Long userMessageId) {
        return new PolicyDecision(PolicyOutcome.TAKEOVER_ACTIVE, remainingSeconds, userMessageId);
    }

    public static PolicyDecision proceed(Long userMessageId) {
        return new PolicyDecision(PolicyOutcome.PROCEED, null, userMessageId);
    }

    public boolean shouldProceed() {
        return outcome == PolicyOutcome.PROCEED;
    }
}
