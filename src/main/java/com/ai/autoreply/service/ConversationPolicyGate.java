package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.conversation.PolicyDecision;
import com.ai.autoreply.conversation.PolicyOutcome;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.ConversationTakeover;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.exception.GatewayException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered chain deciding whether the agent answers an inbound message:
 * owner message, ghost mode, operating hours, active takeover, proceed.
 */
@Service
public class ConversationPolicyGate {

    private static final Logger log = LoggerFactory.getLogger(ConversationPolicyGate.class);

    private final ConversationStateService stateService;
    private final GatewayClientFactory gatewayClientFactory;
    private final SystemLogService systemLogService;
    private final ResponsePhrases phrases;
    private final Clock clock;
    private final ZoneId defaultZone;

    public ConversationPolicyGate(ConversationStateService stateService,
                                  GatewayClientFactory gatewayClientFactory,
                                  SystemLogService systemLogService,
                                  ResponsePhrases phrases,
                                  Clock clock,
                                  @Value("${autoreply.prompt.timezone:America/Sao_Paulo}") String defaultTimezone) {
        this.stateService = stateService;
        this.gatewayClientFactory = gatewayClientFactory;
        this.systemLogService = systemLogService;
        this.phrases = phrases;
        this.clock = clock;
        this.defaultZone = ZoneId.of(defaultTimezone);
    }

    public PolicyDecision evaluate(Agent agent, ConversationKey key, NormalizedContent content, boolean fromOwner) {
        if (fromOwner) {
            stateService.appendOwnerMessage(key, content.getText());
            stateService.markTakeover(key);
            return PolicyDecision.terminal(PolicyOutcome.OWNER_MESSAGE_STORED, null);
        }

        ConversationMessage userMessage = stateService.appendUserMessage(key, content.getText(), content.isAudio());
        stateService.recordUserActivity(key);
        Long userMessageId = userMessage.getId();

        if (agent.isGhostMode()) {
            log.info("[{}] Ghost mode, message stored without reply", key);
            return PolicyDecision.terminal(PolicyOutcome.GHOST_MODE, userMessageId);
        }

        if (agent.isOperatingHoursEnabled() && !isWithinOperatingHours(agent, clock.instant())) {
            sendOutOfHours(agent, key);
            return PolicyDecision.terminal(PolicyOutcome.OUT_OF_HOURS, userMessageId);
        }

        Optional<ConversationTakeover> takeover = stateService.findTakeover(key);
        if (takeover.isPresent()) {
            long elapsed = Duration.between(takeover.get().getTakenOverAt(), clock.instant()).getSeconds();
            long remaining = agent.getTakeoverTimeout() - elapsed;
            if (remaining > 0) {
                log.info("[{}] Owner takeover active, {}s remaining", key, remaining);
                return PolicyDecision.takeoverActive(remaining, userMessageId);
            }
            stateService.clearTakeover(key);
        }

        return PolicyDecision.proceed(userMessageId);
    }

    /**
     * Minute-granularity check of {@code [start, end)} in the agent's timezone.
     * A window whose start is after its end spans midnight; equal bounds mean always open.
     */
    boolean isWithinOperatingHours(Agent agent, Instant now) {
        LocalTime start = agent.getOperatingHoursStart();
        LocalTime end = agent.getOperatingHoursEnd();
        if (start == null || end == null || start.equals(end)) {
            return true;
        }
        LocalTime local = now.atZone(zoneOf(agent)).toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        if (start.isBefore(end)) {
            return !local.isBefore(start) && local.isBefore(end);
        }
        return !local.isBefore(start) || local.isBefore(end);
    }

    private ZoneId zoneOf(Agent agent) {
        if (StringUtils.isBlank(agent.getOperatingHoursTimezone())) {
            return defaultZone;
        }
        try {
            return ZoneId.of(agent.getOperatingHoursTimezone());
        } catch (DateTimeException e) {
            log.warn("Agent {} has invalid timezone '{}', using {}", agent.getId(), agent.getOperatingHoursTimezone(), defaultZone);
            return defaultZone;
        }
    }

    private void sendOutOfHours(Agent agent, ConversationKey key) {
        String text = StringUtils.defaultIfBlank(agent.getOutOfHoursMessage(), phrases.outOfHoursDefault());
        try {
            gatewayClientFactory.forAgent(agent).sendText(agent.getInstanceName(), key.getPhoneNumber(), text);
        } catch (GatewayException e) {
            log.error("[{}] Failed to send out-of-hours message", key, e);
            systemLogService.whatsapp(agent.getId(), SystemLog.Type.ERROR, "Out-of-hours message failed",
                    Map.of("error", String.valueOf(e.getMessage())), key.getPhoneNumber());
            return;
        }
        stateService.appendAgentMessage(key, text);
        stateService.recordAgentActivity(key);
        log.info("[{}] Out of hours, sent out-of-hours message", key);
    }
}
