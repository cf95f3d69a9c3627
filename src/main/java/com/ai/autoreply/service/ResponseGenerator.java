package com.ai.autoreply.service;

import com.ai.autoreply.client.CompletionClient;
import com.ai.autoreply.client.CompletionClientFactory;
import com.ai.autoreply.conversation.ContentKind;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.dto.ChatTurn;
import com.ai.autoreply.dto.CompletionResult;
import com.ai.autoreply.dto.UserContent;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.AgentDocument;
import com.ai.autoreply.entity.AgentMedia;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.RequiredField;
import com.ai.autoreply.entity.SystemLog;
import com.ai.autoreply.exception.CompletionException;
import com.ai.autoreply.repository.AgentDocumentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the system prompt, history and tool set for one turn and calls the completion service.
 */
@Service
public class ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    public static final String TOOL_SEND_MEDIA = "send_media";
    public static final String TOOL_NOTIFY_HUMAN = "notify_human";
    public static final String TOOL_COLLECT_CUSTOMER_INFO = "collect_customer_info";
    public static final String CHUNK_DELIMITER = "---";

    private static final int TEXT_PREVIEW_LENGTH = 100;

    private final CompletionClientFactory completionClientFactory;
    private final ConversationStateService stateService;
    private final AgentDocumentRepository documentRepository;
    private final SystemLogService systemLogService;
    private final Clock clock;
    private final int historyLimit;
    private final ZoneId defaultZone;
    private final Locale locale;
    private final boolean attachImage;

    public ResponseGenerator(CompletionClientFactory completionClientFactory,
                             ConversationStateService stateService,
                             AgentDocumentRepository documentRepository,
                             SystemLogService systemLogService,
                             Clock clock,
                             @Value("${autoreply.history.limit:10}") int historyLimit,
                             @Value("${autoreply.prompt.timezone:America/Sao_Paulo}") String defaultTimezone,
                             @Value("${autoreply.prompt.locale:pt-BR}") String locale,
                             @Value("${autoreply.response.attach-image:true}") boolean attachImage) {
        this.completionClientFactory = completionClientFactory;
        this.stateService = stateService;
        this.documentRepository = documentRepository;
        this.systemLogService = systemLogService;
        this.clock = clock;
        this.historyLimit = historyLimit;
        this.defaultZone = ZoneId.of(defaultTimezone);
        this.locale = Locale.forLanguageTag(locale);
        this.attachImage = attachImage;
    }

    /**
     * Runs the completion for an inbound WhatsApp message. The current user message is excluded from
     * history since it is sent as the user turn.
     */
    public CompletionResult generate(Agent agent, ConversationKey key, NormalizedContent content,
                                     Long currentMessageId, List<AgentMedia> catalog) {
        List<ConversationMessage> history = stateService.recentHistory(key, currentMessageId, historyLimit);
        List<ChatTurn> turns = toTurns(history);

        StringBuilder prompt = basePrompt(agent);
        appendMediaCatalog(prompt, catalog);
        boolean canTransfer = StringUtils.isNotBlank(agent.getTransferNumber());
        if (canTransfer) {
            appendTransferPolicy(prompt, agent, key, history, content.getText());
        }

        List<Map<String, Object>> tools = new ArrayList<>();
        if (catalog != null && !catalog.isEmpty()) {
            tools.add(sendMediaTool());
        }
        if (canTransfer) {
            tools.add(notifyHumanTool());
            tools.add(collectCustomerInfoTool());
        }

        UserContent userContent = attachImage && content.getKind() == ContentKind.IMAGE
                ? new UserContent(content.getText(), content.getImageBase64())
                : UserContent.text(content.getText());

        CompletionClient client = completionClientFactory.forAgent(agent);
        String model = completionClientFactory.modelFor(agent);
        CompletionResult result = complete(client, model, prompt.toString(), turns, userContent, tools, key);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model", model);
        details.put("hasToolCalls", result.hasToolCalls());
        details.put("toolCallsCount", result.getToolCalls().size());
        details.put("textPreview", StringUtils.abbreviate(result.getText(), TEXT_PREVIEW_LENGTH));
        systemLogService.whatsapp(agent.getId(), SystemLog.Type.INFO, "Completion response received", details,
                key.getPhoneNumber());
        return result;
    }

    /**
     * Plain reply for the website widget: persona, date and documents, no tools.
     */
    public String generateWidgetReply(Agent agent, List<ChatTurn> history, String message) {
        CompletionClient client = completionClientFactory.forAgent(agent);
        String model = completionClientFactory.modelFor(agent);
        CompletionResult result = client.completeChat(model, basePrompt(agent).toString(), history,
                UserContent.text(message), Collections.emptyList());
        return result.getText().trim();
    }

    private CompletionResult complete(CompletionClient client, String model, String systemPrompt, List<ChatTurn> turns,
                                      UserContent userContent, List<Map<String, Object>> tools, ConversationKey key) {
        try {
            return client.completeChat(model, systemPrompt, turns, userContent, tools);
        } catch (CompletionException e) {
            if (tools.isEmpty()) {
                throw e;
            }
            log.warn("[{}] Completion with {} tool(s) failed on {}, retrying without tools: {}",
                    key, tools.size(), model, e.getMessage());
            return client.completeChat(model, systemPrompt, turns, userContent, Collections.emptyList());
        }
    }

    StringBuilder basePrompt(Agent agent) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(StringUtils.defaultString(agent.getPrompt()).trim());

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneOf(agent)));
        prompt.append("\n\n## Current date and time\n")
                .append(now.format(DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy, HH:mm", locale)))
                .append(" (").append(now.getZone().getId()).append(")");

        prompt.append("\n\n## Reply style\n")
                .append("Write like a person chatting on WhatsApp: natural, friendly and short. ")
                .append("Split longer answers into a few short messages separated by a line containing only ")
                .append(CHUNK_DELIMITER).append(".");

        List<AgentDocument> documents = documentRepository.findByAgentIdOrderByIdAsc(agent.getId());
        StringBuilder knowledge = new StringBuilder();
        for (AgentDocument document : documents) {
            if (StringUtils.isBlank(document.getContent())) continue;
            knowledge.append("\n\n### ").append(document.getName()).append("\n").append(document.getContent().trim());
        }
        if (knowledge.length() > 0) {
            prompt.append("\n\n## Knowledge base").append(knowledge);
        }
        return prompt;
    }

    private void appendMediaCatalog(StringBuilder prompt, List<AgentMedia> catalog) {
        if (catalog == null || catalog.isEmpty()) {
            return;
        }
        prompt.append("\n\n## Available products and media\n");
        for (int i = 0; i < catalog.size(); i++) {
            AgentMedia item = catalog.get(i);
            prompt.append(i + 1).append(". [").append(item.getType()).append("] \"")
                    .append(item.getName()).append("\" - ").append(item.getDescription()).append("\n");
        }
        prompt.append("\n## Mandatory rules for sending media\n")
                .append("1. NEVER use markdown image syntax such as ![name](url). It does not work on WhatsApp.\n")
                .append("2. ALWAYS call the \"").append(TOOL_SEND_MEDIA).append("\" tool to send photos, videos or documents.\n")
                .append("3. When the user asks about a product, call ").append(TOOL_SEND_MEDIA)
                .append(" with the media name as listed above.\n")
                .append("4. Use the descriptions to decide which media answers the question.\n")
                .append("5. If nothing matches, say that no image is available.");
    }

    private void appendTransferPolicy(StringBuilder prompt, Agent agent, ConversationKey key,
                                      List<ConversationMessage> history, String currentMessage) {
        prompt.append("\n\n## Handing off to a human\n")
                .append("You can notify a human teammate on WhatsApp. Call \"").append(TOOL_NOTIFY_HUMAN)
                .append("\" ONLY when:\n")
                .append("- the customer explicitly asks to talk to a person\n")
                .append("- the customer confirms an order or purchase\n")
                .append("- you cannot solve the customer's problem\n")
                .append("- the customer is unhappy or frustrated\n");
        if (StringUtils.isNotBlank(agent.getTransferInstructions())) {
            prompt.append("\n### Business instructions\n").append(agent.getTransferInstructions().trim()).append("\n");
        }
        List<RequiredField> requiredFields = agent.getRequiredFields();
        if (requiredFields != null && !requiredFields.isEmpty()) {
            appendRequiredFields(prompt, requiredFields, stateService.collectedData(key));
        }
        prompt.append("\n## Collecting customer details\n")
                .append("Call \"").append(TOOL_COLLECT_CUSTOMER_INFO)
                .append("\" whenever the customer gives an important detail such as a name, document number ")
                .append("or address.\n");
        prompt.append("\nWhen calling ").append(TOOL_NOTIFY_HUMAN).append(", copy the COMPLETE conversation below ")
                .append("into conversation_history, including the customer's current message:\n\n")
                .append("---BEGIN HISTORY---\n")
                .append(transcript(history, currentMessage))
                .append("\n---END HISTORY---");
    }

    static void appendRequiredFields(StringBuilder prompt, List<RequiredField> requiredFields,
                                     Map<String, String> collected) {
        prompt.append("\n### Details required before handing off\n");
        int missing = 0;
        for (RequiredField field : requiredFields) {
            String value = collected.get(field.getKey());
            prompt.append("- ").append(field.getKey()).append(": ");
            if (StringUtils.isNotBlank(value)) {
                prompt.append("collected \"").append(value).append("\"\n");
            } else {
                missing++;
                prompt.append("MISSING (ask: \"").append(StringUtils.defaultString(field.getQuestion())).append("\")\n");
            }
        }
        if (missing > 0) {
            prompt.append(missing).append(" required detail(s) still missing. Ask for them and record each one with ")
                    .append(TOOL_COLLECT_CUSTOMER_INFO).append(" before calling ").append(TOOL_NOTIFY_HUMAN).append(".\n");
        } else {
            prompt.append("All required details are collected. You may call ").append(TOOL_NOTIFY_HUMAN).append(".\n");
        }
    }

    static String transcript(List<ConversationMessage> history, String currentMessage) {
        StringBuilder sb = new StringBuilder();
        for (ConversationMessage message : history) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(message.getSender() == ConversationMessage.Sender.USER ? "Customer: " : "Agent: ")
                    .append(message.getContent());
        }
        if (StringUtils.isNotBlank(currentMessage)) {
            if (sb.length() > 0) sb.append("\n");
            sb.append("Customer: ").append(currentMessage);
        }
        return sb.toString();
    }

    static List<ChatTurn> toTurns(List<ConversationMessage> history) {
        List<ChatTurn> turns = new ArrayList<>(history.size());
        for (ConversationMessage message : history) {
            String role = message.getSender() == ConversationMessage.Sender.USER ? ChatTurn.USER : ChatTurn.ASSISTANT;
            turns.add(new ChatTurn(role, message.getContent()));
        }
        return turns;
    }

    private ZoneId zoneOf(Agent agent) {
        if (StringUtils.isBlank(agent.getOperatingHoursTimezone())) {
            return defaultZone;
        }
        try {
            return ZoneId.of(agent.getOperatingHoursTimezone());
        } catch (DateTimeException e) {
            return defaultZone;
        }
    }

    private static Map<String, Object> sendMediaTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("media_names", Map.of(
                "type", "array",
                "items", Map.of("type", "string"),
                "description", "Exact names of the media to send, as listed in the catalog"));
        properties.put("message", Map.of(
                "type", "string",
                "description", "Optional text to accompany the media"));
        return function(TOOL_SEND_MEDIA,
                "Sends product photos, videos or documents to the user. Use when the user asks about a specific "
                        + "product or asks to see images or videos.",
                properties, List.of("media_names"));
    }

    private static Map<String, Object> notifyHumanTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("reason", Map.of("type", "string",
                "description", "Why the conversation is being handed off"));
        properties.put("conversation_history", Map.of("type", "string",
                "description", "COMPLETE conversation formatted as \"Customer: ...\\nAgent: ...\""));
        properties.put("order_details", Map.of("type", "string",
                "description", "Order details when applicable: products, quantities, prices, address, payment"));
        properties.put("customer_name", Map.of("type", "string",
                "description", "Customer name if mentioned"));
        return function(TOOL_NOTIFY_HUMAN,
                "Notifies a human teammate on WhatsApp when the conversation must be handed off or needs human "
                        + "intervention.",
                properties, List.of("reason", "conversation_history"));
    }

    private static Map<String, Object> collectCustomerInfoTool() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("field_key", Map.of("type", "string",
                "description", "Name of the detail, for example \"name\", \"document\" or \"address\""));
        properties.put("field_value", Map.of("type", "string",
                "description", "Value the customer gave"));
        return function(TOOL_COLLECT_CUSTOMER_INFO,
                "Records a detail the customer provided during the conversation, such as their name, document "
                        + "number or address.",
                properties, List.of("field_key", "field_value"));
    }

    private static Map<String, Object> function(String name, String description, Map<String, Object> properties,
                                                List<String> required) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);
        parameters.put("required", required);

        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", parameters);

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("type", "function");
        tool.put("function", function);
        return tool;
    }
}
