package com.ai.autoreply.conversation;

public enum PolicyOutcome {
    OWNER_MESSAGE_STORED("owner_message_stored"),
    GHOST_MODE("ghost_mode"),
    OUT_OF_HOURS("out_of_hours"),
    TAKEOVER_ACTIVE("takeover_active"),
    PROCEED("proceed");

    private final String code;

    PolicyOutcome(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
