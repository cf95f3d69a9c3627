package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.dto.HumanHandoff;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.SystemLog;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends the handoff summary to the agent's transfer number. Never throws.
 */
@Service
public class HumanHandoffNotifier {

    private static final Logger log = LoggerFactory.getLogger(HumanHandoffNotifier.class);

    private final GatewayClientFactory gatewayClientFactory;
    private final SystemLogService systemLogService;

    public HumanHandoffNotifier(GatewayClientFactory gatewayClientFactory, SystemLogService systemLogService) {
        this.gatewayClientFactory = gatewayClientFactory;
        this.systemLogService = systemLogService;
    }

    public boolean notify(Agent agent, ConversationKey key, HumanHandoff handoff) {
        if (StringUtils.isBlank(agent.getTransferNumber())) {
            log.warn("[{}] Handoff requested but agent {} has no transfer number", key, agent.getId());
            return false;
        }
        try {
            gatewayClientFactory.forAgent(agent)
                    .sendText(agent.getInstanceName(), agent.getTransferNumber().trim(), format(agent, handoff));
            log.info("[{}] Handoff notification sent to {}", key, agent.getTransferNumber());
            return true;
        } catch (Exception e) {
            log.error("[{}] Failed to send handoff notification", key, e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("transferNumber", agent.getTransferNumber());
            details.put("error", String.valueOf(e.getMessage()));
            systemLogService.whatsapp(agent.getId(), SystemLog.Type.ERROR, "Handoff notification failed",
                    details, key.getPhoneNumber());
            return false;
        }
    }

    static String format(Agent agent, HumanHandoff handoff) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔔 *Human handoff requested*\n\n");
        sb.append("*Agent:* ").append(agent.getName()).append("\n");
        sb.append("*Reason:* ").append(handoff.getReason()).append("\n");
        if (StringUtils.isNotBlank(handoff.getCustomerName())) {
            sb.append("*Customer:* ").append(handoff.getCustomerName()).append("\n");
        }
        sb.append("*Phone:* ").append(handoff.getCustomerPhone()).append("\n");
        if (StringUtils.isNotBlank(handoff.getOrderDetails())) {
            sb.append("\n*Order details:*\n").append(handoff.getOrderDetails()).append("\n");
        }
        sb.append("\n*Conversation:*\n").append(handoff.getConversationHistory());
        return sb.toString();
    }
}
