package com.ai.autoreply.dto;

import com.ai.autoreply.entity.AgentFaq;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FaqMatch {

    private final AgentFaq faq;
    private final int score;

    public String getAnswer() {
        return faq.getAnswer();
    }
}
