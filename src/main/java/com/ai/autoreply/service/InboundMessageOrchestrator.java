package com.ai.autoreply.service;

import com.ai.autoreply.client.CompletionClientFactory;
import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.component.EventDeduplicator;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.conversation.PolicyDecision;
import com.ai.autoreply.dto.AgentReply;
import com.ai.autoreply.dto.CompletionResult;
import com.ai.autoreply.dto.WebhookEvent;
import com.ai.autoreply.dto.WebhookOutcome;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.AgentMedia;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.exception.CompletionException;
import com.ai.autoreply.exception.GatewayException;
import com.ai.autoreply.exception.PartialDeliveryException;
import com.ai.autoreply.repository.AgentMediaRepository;
import com.ai.autoreply.repository.AgentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one inbound gateway event through dedup, normalization, policy, generation and delivery.
 * Everything happens on the calling thread. A requested handoff is notified even when the customer-facing
 * delivery fails.
 */
@Service
public class InboundMessageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageOrchestrator.class);

    static final String REASON_DUPLICATE = "duplicate";
    static final String REASON_NO_AGENT = "no_agent";
    static final String REASON_NO_CONTACT = "no_contact";
    static final String REASON_NO_CONTENT = "no_content";
    static final String REASON_DELIVERY_FAILED = "delivery_failed";
    static final String REASON_REPLIED = "replied";

    private final EventDeduplicator deduplicator;
    private final AgentRepository agentRepository;
    private final AgentMediaRepository mediaRepository;
    private final ContentNormalizer normalizer;
    private final ConversationPolicyGate policyGate;
    private final ResponseGenerator responseGenerator;
    private final ToolCallInterpreter interpreter;
    private final MessagePacer pacer;
    private final MediaDeliveryService mediaDelivery;
    private final HumanHandoffNotifier handoffNotifier;
    private final ConversationStateService stateService;
    private final GatewayClientFactory gatewayClientFactory;
    private final CompletionClientFactory completionClientFactory;
    private final SystemLogService systemLogService;

    public InboundMessageOrchestrator(EventDeduplicator deduplicator,
                                      AgentRepository agentRepository,
                                      AgentMediaRepository mediaRepository,
                                      ContentNormalizer normalizer,
                                      ConversationPolicyGate policyGate,
                                      ResponseGenerator responseGenerator,
                                      ToolCallInterpreter interpreter,
                                      MessagePacer pacer,
                                      MediaDeliveryService mediaDelivery,
                                      HumanHandoffNotifier handoffNotifier,
                                      ConversationStateService stateService,
                                      GatewayClientFactory gatewayClientFactory,
                                      CompletionClientFactory completionClientFactory,
                                      SystemLogService systemLogService) {
        this.deduplicator = deduplicator;
        this.agentRepository = agentRepository;
        this.mediaRepository = mediaRepository;
        this.normalizer = normalizer;
        this.policyGate = policyGate;
        this.responseGenerator = responseGenerator;
        this.interpreter = interpreter;
        this.pacer = pacer;
        this.mediaDelivery = mediaDelivery;
        this.handoffNotifier = handoffNotifier;
        this.stateService = stateService;
        this.gatewayClientFactory = gatewayClientFactory;
        this.completionClientFactory = completionClientFactory;
        this.systemLogService = systemLogService;
    }

    public WebhookOutcome handle(String instanceName, WebhookEvent event) {
        String messageId = event.messageId();
        if (!deduplicator.markIfNew(messageId)) {
            log.info("Duplicate event {} for instance {} ignored", messageId, instanceName);
            return WebhookOutcome.ignored(REASON_DUPLICATE);
        }

        Optional<Agent> found = agentRepository.findFirstByInstanceNameAndStatus(instanceName, Agent.Status.ONLINE);
        if (found.isEmpty()) {
            log.info("No online agent for instance {}", instanceName);
            return WebhookOutcome.ignored(REASON_NO_AGENT);
        }
        Agent agent = found.get();

        String phoneNumber = event.phoneNumber();
        if (StringUtils.isBlank(phoneNumber)) {
            return WebhookOutcome.ignored(REASON_NO_CONTACT);
        }
        ConversationKey key = ConversationKey.of(agent.getId(), phoneNumber);

        NormalizedContent content = normalizer.normalize(agent, event);
        if (content.isEmpty()) {
            log.debug("[{}] Event {} has no usable content", key, messageId);
            return WebhookOutcome.ignored(REASON_NO_CONTENT);
        }
        if (content.isDegraded()) {
            log.info("[{}] Continuing with placeholder for {} content", key, content.getKind());
        }

        PolicyDecision decision = policyGate.evaluate(agent, key, content, event.isFromOwner());
        if (!decision.shouldProceed()) {
            return WebhookOutcome.builder()
                    .status(WebhookOutcome.STATUS_OK)
                    .reason(decision.getOutcome().code())
                    .messageId(messageId)
                    .remainingSeconds(decision.getRemainingSeconds())
                    .build();
        }

        List<AgentMedia> catalog = mediaRepository.findByAgentIdOrderByIdAsc(agent.getId());
        CompletionResult completion = responseGenerator.generate(agent, key, content, decision.getUserMessageId(), catalog);
        AgentReply reply = interpreter.interpret(key, completion, catalog);
        List<String> chunks = pacer.split(reply.getText());

        stateService.appendAgentMessage(key, String.join("\n\n", chunks));
        stateService.recordAgentActivity(key);

        GatewayClient gateway = gatewayClientFactory.forAgent(agent);
        boolean voiceReply = content.isAudio() && agent.isAudioResponseEnabled();
        int messagesSent = 0;
        int mediaSent = 0;
        GatewayException failure = null;
        try {
            messagesSent = voiceReply
                    ? deliverVoice(gateway, agent, key, chunks)
                    : pacer.deliver(gateway, agent.getInstanceName(), phoneNumber, chunks);
            mediaSent = mediaDelivery.deliver(gateway, agent.getInstanceName(), key, reply.getMedia());
        } catch (PartialDeliveryException e) {
            messagesSent = e.getDelivered();
            failure = e;
        } catch (GatewayException e) {
            failure = e;
        }

        if (reply.hasHandoff()) {
            handoffNotifier.notify(agent, key, reply.getHandoff());
        }

        if (failure != null) {
            log.error("[{}] Reply delivery failed after {} message(s)", key, messagesSent, failure);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("messagesSent", messagesSent);
            details.put("source", reply.getSource().name());
            details.put("error", String.valueOf(failure.getMessage()));
            systemLogService.whatsapp(agent.getId(), SystemLog.Type.ERROR, "Reply delivery failed", details, phoneNumber);
            return WebhookOutcome.builder()
                    .status(WebhookOutcome.STATUS_OK)
                    .reason(REASON_DELIVERY_FAILED)
                    .messageId(messageId)
                    .messagesSent(messagesSent)
                    .mediaSent(mediaSent)
                    .takeover(reply.hasHandoff() ? Boolean.TRUE : null)
                    .build();
        }

        log.info("[{}] Replied with {} message(s), {} media file(s), source={}",
                key, messagesSent, mediaSent, reply.getSource());
        return WebhookOutcome.builder()
                .status(WebhookOutcome.STATUS_OK)
                .reason(REASON_REPLIED)
                .messageId(messageId)
                .messagesSent(messagesSent)
                .mediaSent(mediaSent)
                .takeover(reply.hasHandoff() ? Boolean.TRUE : null)
                .build();
    }

    /**
     * Answers an audio message with one synthesized voice note. Falls back to paced text when synthesis
     * or the audio send fails.
     */
    private int deliverVoice(GatewayClient gateway, Agent agent, ConversationKey key, List<String> chunks) {
        if (chunks.isEmpty()) {
            return 0;
        }
        String text = String.join("\n\n", chunks);
        try {
            byte[] audio = completionClientFactory.forAgent(agent).speak(text, agent.getAudioResponseVoice());
            gateway.sendAudio(agent.getInstanceName(), key.getPhoneNumber(), Base64.getEncoder().encodeToString(audio));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("voice", agent.getAudioResponseVoice());
            details.put("audioSize", audio.length);
            systemLogService.whatsapp(agent.getId(), SystemLog.Type.INFO, "Audio reply sent", details, key.getPhoneNumber());
            return 1;
        } catch (CompletionException | GatewayException e) {
            log.warn("[{}] Audio reply failed, sending text instead: {}", key, e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("voice", agent.getAudioResponseVoice());
            details.put("error", String.valueOf(e.getMessage()));
            systemLogService.whatsapp(agent.getId(), SystemLog.Type.ERROR, "Audio reply failed, sending text",
                    details, key.getPhoneNumber());
            return pacer.deliver(gateway, agent.getInstanceName(), key.getPhoneNumber(), chunks);
        }
    }
}
