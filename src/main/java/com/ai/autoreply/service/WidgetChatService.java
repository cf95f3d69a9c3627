package com.ai.autoreply.service;

import com.ai.autoreply.dto.ChatTurn;
import com.ai.autoreply.dto.FaqMatch;
import com.ai.autoreply.dto.WidgetChatResponse;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.entity.WidgetMessage;
import com.ai.autoreply.repository.AgentRepository;
import com.ai.autoreply.repository.WidgetMessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Website chat widget: FAQ answer when one matches, otherwise a plain model reply.
 */
@Service
public class WidgetChatService {

    private static final Logger log = LoggerFactory.getLogger(WidgetChatService.class);

    private final AgentRepository agentRepository;
    private final WidgetMessageRepository widgetMessageRepository;
    private final FaqService faqService;
    private final ResponseGenerator responseGenerator;
    private final int historyLimit;

    public WidgetChatService(AgentRepository agentRepository,
                             WidgetMessageRepository widgetMessageRepository,
                             FaqService faqService,
                             ResponseGenerator responseGenerator,
                             @Value("${autoreply.history.limit:10}") int historyLimit) {
        this.agentRepository = agentRepository;
        this.widgetMessageRepository = widgetMessageRepository;
        this.faqService = faqService;
        this.responseGenerator = responseGenerator;
        this.historyLimit = historyLimit;
    }

    public Optional<Agent> findWidgetAgent(Long agentId) {
        return agentRepository.findByIdAndWidgetEnabledTrue(agentId);
    }

    public WidgetChatResponse chat(Agent agent, String message, String requestedSessionId) {
        String sessionId = StringUtils.defaultIfBlank(requestedSessionId, UUID.randomUUID().toString());
        String text = message.trim();

        Optional<FaqMatch> faq = faqService.lookup(agent.getId(), text);
        String response;
        if (faq.isPresent()) {
            faqService.recordUsage(faq.get(), agent.getId(), sessionId, SystemLog.Source.WIDGET);
            response = faq.get().getAnswer();
            log.info("Widget session {} answered from FAQ {}", sessionId, faq.get().getFaq().getId());
        } else {
            response = responseGenerator.generateWidgetReply(agent, history(agent.getId(), sessionId), text);
        }

        save(agent.getId(), sessionId, text, response);
        return new WidgetChatResponse(response, sessionId, faq.isPresent());
    }

    private List<ChatTurn> history(Long agentId, String sessionId) {
        List<WidgetMessage> newestFirst = widgetMessageRepository.findByAgentIdAndSessionIdOrderByIdDesc(
                agentId, sessionId, PageRequest.of(0, historyLimit));
        List<ChatTurn> turns = new ArrayList<>(newestFirst.size());
        for (WidgetMessage m : newestFirst) {
            turns.add(new ChatTurn(m.getSender() == ConversationMessage.Sender.USER ? ChatTurn.USER : ChatTurn.ASSISTANT,
                    m.getContent()));
        }
        Collections.reverse(turns);
        return turns;
    }

    private void save(Long agentId, String sessionId, String userText, String response) {
        try {
            widgetMessageRepository.save(WidgetMessage.builder()
                    .agentId(agentId).sessionId(sessionId)
                    .sender(ConversationMessage.Sender.USER).content(userText)
                    .build());
            widgetMessageRepository.save(WidgetMessage.builder()
                    .agentId(agentId).sessionId(sessionId)
                    .sender(ConversationMessage.Sender.AGENT).content(response)
                    .build());
        } catch (Exception e) {
            log.warn("Failed to save widget messages for session {}", sessionId, e);
        }
    }
}
