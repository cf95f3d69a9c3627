package com.ai.autoreply.dto;

import com.ai.autoreply.conversation.ReplySource;
import com.ai.autoreply.entity.AgentMedia;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Outbound decision for one turn: reply text, media to push, optional handoff.
 */
@Getter
@ToString
public class AgentReply {

    private final String text;
    private final List<AgentMedia> media;
    private final HumanHandoff handoff;
    private final ReplySource source;

    public AgentReply(String text, List<AgentMedia> media, HumanHandoff handoff, ReplySource source) {
        this.text = text;
        this.media = media != null ? List.copyOf(media) : Collections.emptyList();
        this.handoff = handoff;
        this.source = source;
    }

    public boolean hasHandoff() {
        return handoff != null;
    }
}
