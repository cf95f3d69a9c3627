package com.ai.autoreply.conversation;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of one conversation: the agent plus the contact's phone number.
 */
@Value
public class ConversationKey {

    @NonNull
    Long agentId;

    @NonNull
    String phoneNumber;

    public static ConversationKey of(Long agentId, String phoneNumber) {
        return new ConversationKey(agentId, phoneNumber);
    }

    @Override
    public String toString() {
        return agentId + ":" + phoneNumber;
    }
}
