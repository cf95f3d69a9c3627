package com.ai.autoreply.service;

import com.ai.autoreply.component.MediaMatcher;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.conversation.ReplySource;
import com.ai.autoreply.dto.AgentReply;
import com.ai.autoreply.dto.CompletionResult;
import com.ai.autoreply.dto.HumanHandoff;
import com.ai.autoreply.dto.ToolCall;
import com.ai.autoreply.entity.AgentMedia;
import com.ai.autoreply.entity.SystemLog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the model's text and tool calls to the reply actually sent.
 * A handoff beats media; media beats model text; an empty result becomes a fallback apology.
 */
@Service
public class ToolCallInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ToolCallInterpreter.class);

    private static final int HISTORY_PREVIEW_LENGTH = 500;

    private final MediaMatcher mediaMatcher;
    private final ResponsePhrases phrases;
    private final ConversationStateService stateService;
    private final SystemLogService systemLogService;
    private final ObjectMapper mapper;

    public ToolCallInterpreter(MediaMatcher mediaMatcher, ResponsePhrases phrases,
                               ConversationStateService stateService,
                               SystemLogService systemLogService, ObjectMapper mapper) {
        this.mediaMatcher = mediaMatcher;
        this.phrases = phrases;
        this.stateService = stateService;
        this.systemLogService = systemLogService;
        this.mapper = mapper;
    }

    public AgentReply interpret(ConversationKey key, CompletionResult result, List<AgentMedia> catalog) {
        List<AgentMedia> catalogItems = catalog != null ? catalog : Collections.emptyList();
        List<AgentMedia> matched = new ArrayList<>();
        HumanHandoff handoff = null;
        String suggestedMessage = null;
        boolean mediaRequested = false;

        for (ToolCall call : result.getToolCalls()) {
            if (ResponseGenerator.TOOL_SEND_MEDIA.equals(call.getName())) {
                Optional<JsonNode> args = parseArguments(key, call);
                if (args.isEmpty()) continue;
                mediaRequested = true;
                String message = StringUtils.trimToNull(args.get().path("message").asText(null));
                if (message != null) {
                    suggestedMessage = message;
                }
                collectMedia(key, args.get(), catalogItems, matched, message);
            } else if (ResponseGenerator.TOOL_NOTIFY_HUMAN.equals(call.getName())) {
                Optional<JsonNode> args = parseArguments(key, call);
                if (args.isEmpty()) continue;
                handoff = toHandoff(key, args.get());
            } else if (ResponseGenerator.TOOL_COLLECT_CUSTOMER_INFO.equals(call.getName())) {
                parseArguments(key, call).ifPresent(args -> recordCustomerInfo(key, args));
            } else {
                log.warn("[{}] Ignoring unknown tool call {}", key, call.getName());
            }
        }

        AgentReply reply;
        if (handoff != null) {
            reply = new AgentReply(phrases.handoffAcknowledgement(), Collections.emptyList(), handoff, ReplySource.HANDOFF);
        } else if (!matched.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("mediaNames", matched.stream().map(AgentMedia::getName).toList());
            details.put("mediaTypes", matched.stream().map(m -> String.valueOf(m.getType())).toList());
            systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.MEDIA_SEND,
                    "Sending " + matched.size() + " media item(s)", details, key.getPhoneNumber());
            reply = new AgentReply(StringUtils.defaultIfBlank(suggestedMessage, phrases.mediaAcknowledgement()),
                    matched, null, ReplySource.MEDIA);
        } else if (mediaRequested) {
            reply = new AgentReply(StringUtils.defaultIfBlank(suggestedMessage, phrases.mediaNotFound()),
                    Collections.emptyList(), null, ReplySource.MEDIA_NOT_FOUND);
        } else if (StringUtils.isNotBlank(result.getText())) {
            reply = new AgentReply(result.getText().trim(), Collections.emptyList(), null, ReplySource.MODEL);
        } else {
            reply = new AgentReply(phrases.fallback(), Collections.emptyList(), null, ReplySource.FALLBACK);
        }
        log.info("[{}] Reply source={} media={} handoff={}", key, reply.getSource(), reply.getMedia().size(), reply.hasHandoff());
        return reply;
    }

    private void collectMedia(ConversationKey key, JsonNode args, List<AgentMedia> catalog,
                              List<AgentMedia> matched, String message) {
        List<String> requested = new ArrayList<>();
        for (JsonNode name : args.path("media_names")) {
            if (StringUtils.isNotBlank(name.asText())) {
                requested.add(name.asText());
            }
        }
        List<String> available = catalog.stream().map(AgentMedia::getName).toList();

        Map<String, Object> callDetails = new LinkedHashMap<>();
        callDetails.put("requestedMedia", requested);
        callDetails.put("availableMedia", available);
        callDetails.put("message", StringUtils.defaultString(message));
        systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.TOOL_CALL,
                "Tool: send_media - looking for \"" + String.join(", ", requested) + "\"", callDetails, key.getPhoneNumber());

        for (String name : requested) {
            Optional<AgentMedia> found = mediaMatcher.match(name, catalog);
            if (found.isPresent()) {
                AgentMedia item = found.get();
                if (matched.stream().noneMatch(m -> m == item)) {
                    matched.add(item);
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("requested", name);
                details.put("matched", item.getName());
                details.put("type", String.valueOf(item.getType()));
                details.put("filesCount", item.getFileUrls() != null ? item.getFileUrls().size() : 0);
                systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.MEDIA_MATCH,
                        "Media found: \"" + item.getName() + "\"", details, key.getPhoneNumber());
                log.debug("[{}] Media match \"{}\" -> \"{}\"", key, name, item.getName());
            } else {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("requested", name);
                details.put("availableMedia", available);
                systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.ERROR,
                        "Media not found: \"" + name + "\"", details, key.getPhoneNumber());
                log.info("[{}] No media matches \"{}\"", key, name);
            }
        }
    }

    private void recordCustomerInfo(ConversationKey key, JsonNode args) {
        String fieldKey = StringUtils.trimToNull(args.path("field_key").asText(null));
        String fieldValue = StringUtils.trimToNull(args.path("field_value").asText(null));
        if (fieldKey == null || fieldValue == null) {
            log.warn("[{}] {} called without field_key or field_value", key, ResponseGenerator.TOOL_COLLECT_CUSTOMER_INFO);
            return;
        }
        stateService.recordCollectedField(key, fieldKey, fieldValue);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fieldKey", fieldKey);
        details.put("fieldValue", fieldValue);
        systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.TOOL_CALL,
                "Tool: collect_customer_info - " + fieldKey, details, key.getPhoneNumber());
    }

    private HumanHandoff toHandoff(ConversationKey key, JsonNode args) {
        HumanHandoff handoff = HumanHandoff.builder()
                .reason(StringUtils.defaultIfBlank(args.path("reason").asText(null), phrases.handoffReasonDefault()))
                .conversationHistory(StringUtils.defaultIfBlank(args.path("conversation_history").asText(null),
                        phrases.handoffHistoryDefault()))
                .orderDetails(StringUtils.trimToNull(args.path("order_details").asText(null)))
                .customerName(StringUtils.trimToNull(args.path("customer_name").asText(null)))
                .customerPhone(key.getPhoneNumber())
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", handoff.getReason());
        details.put("conversationHistory", StringUtils.abbreviate(handoff.getConversationHistory(), HISTORY_PREVIEW_LENGTH));
        details.put("orderDetails", handoff.getOrderDetails());
        details.put("customerName", handoff.getCustomerName());
        details.put("customerPhone", handoff.getCustomerPhone());
        systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.TOOL_CALL,
                "Tool: notify_human - \"" + handoff.getReason() + "\"", details, key.getPhoneNumber());
        return handoff;
    }

    private Optional<JsonNode> parseArguments(ConversationKey key, ToolCall call) {
        try {
            JsonNode node = mapper.readTree(StringUtils.defaultIfBlank(call.getArguments(), "{}"));
            return Optional.of(node);
        } catch (Exception e) {
            log.warn("[{}] Malformed arguments for tool {}: {}", key, call.getName(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tool", call.getName());
            details.put("error", String.valueOf(e.getMessage()));
            systemLogService.whatsapp(key.getAgentId(), SystemLog.Type.ERROR,
                    "Failed to process tool call " + call.getName(), details, key.getPhoneNumber());
            return Optional.empty();
        }
    }
}
