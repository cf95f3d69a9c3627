package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.ConversationActivity;
import com.ai.autoreply.repository.AgentRepository;
import com.ai.autoreply.repository.ConversationActivityRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sends one follow-up nudge to contacts who went quiet after the agent's last reply.
 * The nudge is claimed in the database before sending so overlapping sweeps cannot double-send.
 */
@Service
public class InactivitySweeper {

    private static final Logger log = LoggerFactory.getLogger(InactivitySweeper.class);

    private final AgentRepository agentRepository;
    private final ConversationActivityRepository activityRepository;
    private final ConversationStateService stateService;
    private final GatewayClientFactory gatewayClientFactory;
    private final Clock clock;

    public InactivitySweeper(AgentRepository agentRepository,
                             ConversationActivityRepository activityRepository,
                             ConversationStateService stateService,
                             GatewayClientFactory gatewayClientFactory,
                             Clock clock) {
        this.agentRepository = agentRepository;
        this.activityRepository = activityRepository;
        this.stateService = stateService;
        this.gatewayClientFactory = gatewayClientFactory;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${autoreply.inactivity.sweep-interval-ms:30000}",
            initialDelayString = "${autoreply.inactivity.sweep-interval-ms:30000}")
    public void sweep() {
        List<Agent> agents = agentRepository.findByStatusAndGhostModeFalseAndInactivityEnabledTrue(Agent.Status.ONLINE);
        int nudged = 0;
        for (Agent agent : agents) {
            try {
                nudged += sweepAgent(agent);
            } catch (Exception e) {
                log.error("Inactivity sweep failed for agent {}", agent.getId(), e);
            }
        }
        if (nudged > 0) {
            log.info("Inactivity sweep sent {} nudge(s)", nudged);
        }
    }

    int sweepAgent(Agent agent) {
        if (agent.getInactivityTimeout() <= 0) {
            log.warn("Agent {} has inactivity enabled with timeout {}, skipping", agent.getId(), agent.getInactivityTimeout());
            return 0;
        }
        if (StringUtils.isBlank(agent.getInactivityMessage())) {
            log.warn("Agent {} has inactivity enabled without a message, skipping", agent.getId());
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(agent.getInactivityTimeout()));
        List<ConversationActivity> candidates = activityRepository.findAwaitingFollowUp(agent.getId(), cutoff);
        if (candidates.isEmpty()) {
            return 0;
        }

        GatewayClient gateway = gatewayClientFactory.forAgent(agent);
        int sent = 0;
        for (ConversationActivity activity : candidates) {
            ConversationKey key = ConversationKey.of(agent.getId(), activity.getPhoneNumber());
            try {
                if (nudge(agent, gateway, activity, key)) {
                    sent++;
                }
            } catch (Exception e) {
                log.error("[{}] Inactivity nudge failed", key, e);
            }
        }
        return sent;
    }

    private boolean nudge(Agent agent, GatewayClient gateway, ConversationActivity activity, ConversationKey key) {
        if (activityRepository.claimInactivityMessage(activity.getId()) == 0) {
            log.debug("[{}] Nudge already claimed", key);
            return false;
        }
        try {
            gateway.sendText(agent.getInstanceName(), key.getPhoneNumber(), agent.getInactivityMessage());
        } catch (RuntimeException e) {
            activityRepository.releaseInactivityMessage(activity.getId());
            throw e;
        }
        stateService.appendAgentMessage(key, agent.getInactivityMessage());
        stateService.recordAgentActivity(key);
        log.info("[{}] Inactivity nudge sent", key);
        return true;
    }
}
