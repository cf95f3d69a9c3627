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
import com.ai.autoreply.exception.CompletionException;
import com.ai.autoreply.repository.AgentDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResponseGeneratorTest {

    private static final ConversationKey KEY = ConversationKey.of(1L, "5511999990000");
    private static final NormalizedContent QUESTION = NormalizedContent.text(ContentKind.TEXT, "Do you have the Petro Power?");

    private CompletionClient client;
    private ConversationStateService stateService;
    private ResponseGenerator generator;
    private Agent agent;

    @BeforeEach
    void setUp() {
        CompletionClientFactory factory = mock(CompletionClientFactory.class);
        client = mock(CompletionClient.class);
        stateService = mock(ConversationStateService.class);
        AgentDocumentRepository documentRepository = mock(AgentDocumentRepository.class);
        when(factory.forAgent(any())).thenReturn(client);
        when(factory.modelFor(any())).thenReturn("gpt-4o");
        when(stateService.recentHistory(eq(KEY), any(), eq(10))).thenReturn(Collections.emptyList());
        when(documentRepository.findByAgentIdOrderByIdAsc(1L)).thenReturn(List.of(
                AgentDocument.builder().id(1L).agentId(1L).name("Prices").content("PETRO POWER 150 costs R$ 2.500").build()));

        generator = new ResponseGenerator(factory, stateService, documentRepository, mock(SystemLogService.class),
                Clock.fixed(Instant.parse("2024-05-10T15:00:00Z"), ZoneOffset.UTC),
                10, "America/Sao_Paulo", "pt-BR", true);
        agent = Agent.builder().id(1L).name("Store").prompt("You are the Petro store assistant.")
                .instanceName("store").build();
    }

    @Test
    void declaresToolsAndBuildsPromptSections() {
        agent.setTransferNumber("5511888880000");
        agent.setTransferInstructions("Always include the delivery address.");
        List<AgentMedia> catalog = List.of(AgentMedia.builder().id(5L).agentId(1L).type(AgentMedia.Type.IMAGE)
                .name("PETRO POWER 150").description("150cc generator photo").build());
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult("Yes!", null));

        generator.generate(agent, KEY, QUESTION, 42L, catalog);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Map<String, Object>>> tools = ArgumentCaptor.forClass(List.class);
        verify(client).completeChat(eq("gpt-4o"), prompt.capture(), anyList(), any(), tools.capture());

        assertThat(prompt.getValue())
                .startsWith("You are the Petro store assistant.")
                .contains("12:00 (America/Sao_Paulo)")
                .contains(ResponseGenerator.CHUNK_DELIMITER)
                .contains("PETRO POWER 150 costs R$ 2.500")
                .contains("1. [IMAGE] \"PETRO POWER 150\" - 150cc generator photo")
                .contains("NEVER use markdown image syntax")
                .contains("Always include the delivery address.")
                .contains("---BEGIN HISTORY---")
                .contains("Customer: Do you have the Petro Power?");
        assertThat(tools.getValue())
                .extracting(tool -> (Object) ((Map<?, ?>) tool.get("function")).get("name"))
                .containsExactly(ResponseGenerator.TOOL_SEND_MEDIA, ResponseGenerator.TOOL_NOTIFY_HUMAN,
                        ResponseGenerator.TOOL_COLLECT_CUSTOMER_INFO);
    }

    @Test
    void requiredFieldsShowWhatIsStillMissing() {
        agent.setTransferNumber("5511888880000");
        agent.setRequiredFields(List.of(
                new RequiredField("name", "What's your name?"),
                new RequiredField("address", "Where should we deliver?")));
        when(stateService.collectedData(KEY)).thenReturn(Map.of("name", "Ana"));
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult("Sure", null));

        generator.generate(agent, KEY, QUESTION, 42L, Collections.emptyList());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).completeChat(anyString(), prompt.capture(), anyList(), any(), anyList());
        assertThat(prompt.getValue())
                .contains("- name: collected \"Ana\"")
                .contains("- address: MISSING (ask: \"Where should we deliver?\")")
                .contains("1 required detail(s) still missing");
    }

    @Test
    void noToolsWithoutCatalogOrTransferNumber() {
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult("Hello", null));

        generator.generate(agent, KEY, QUESTION, 42L, Collections.emptyList());

        verify(client).completeChat(anyString(), argThat(p -> !p.contains("---BEGIN HISTORY---")), anyList(), any(),
                eq(Collections.emptyList()));
    }

    @Test
    void retriesOnceWithoutToolsWhenToolCallFails() {
        agent.setTransferNumber("5511888880000");
        doThrow(new CompletionException("tools unsupported")).when(client)
                .completeChat(anyString(), anyString(), anyList(), any(), argThat(tools -> tools != null && !tools.isEmpty()));
        doReturn(new CompletionResult("Plain answer", null)).when(client)
                .completeChat(anyString(), anyString(), anyList(), any(), argThat(tools -> tools != null && tools.isEmpty()));

        CompletionResult result = generator.generate(agent, KEY, QUESTION, 42L, Collections.emptyList());

        assertThat(result.getText()).isEqualTo("Plain answer");
        verify(client, times(2)).completeChat(anyString(), anyString(), anyList(), any(), anyList());
    }

    @Test
    void failureWithoutToolsPropagates() {
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenThrow(new CompletionException("500"));

        assertThatThrownBy(() -> generator.generate(agent, KEY, QUESTION, 42L, Collections.emptyList()))
                .isInstanceOf(CompletionException.class);
        verify(client, times(1)).completeChat(anyString(), anyString(), anyList(), any(), anyList());
    }

    @Test
    void historyExcludesCurrentMessageAndMapsRoles() {
        when(stateService.recentHistory(KEY, 42L, 10)).thenReturn(List.of(
                message(ConversationMessage.Sender.USER, "hi"),
                message(ConversationMessage.Sender.AGENT, "hello!"),
                message(ConversationMessage.Sender.OWNER, "I'll handle pricing")));
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult("ok", null));

        generator.generate(agent, KEY, QUESTION, 42L, Collections.emptyList());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatTurn>> history = ArgumentCaptor.forClass(List.class);
        verify(client).completeChat(anyString(), anyString(), history.capture(), any(), anyList());
        assertThat(history.getValue()).extracting(ChatTurn::getRole)
                .containsExactly(ChatTurn.USER, ChatTurn.ASSISTANT, ChatTurn.ASSISTANT);
    }

    @Test
    void imageContentIsSentAsMultimodal() {
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult("Nice photo", null));

        generator.generate(agent, KEY, NormalizedContent.image("[Image received]", "aW1hZ2U="), 42L, Collections.emptyList());

        ArgumentCaptor<UserContent> userContent = ArgumentCaptor.forClass(UserContent.class);
        verify(client).completeChat(anyString(), anyString(), anyList(), userContent.capture(), anyList());
        assertThat(userContent.getValue().hasImage()).isTrue();
        assertThat(userContent.getValue().getImageBase64()).isEqualTo("aW1hZ2U=");
    }

    @Test
    void widgetReplyUsesNoTools() {
        when(client.completeChat(anyString(), anyString(), anyList(), any(), anyList()))
                .thenReturn(new CompletionResult(" We open at 9. ", null));

        String reply = generator.generateWidgetReply(agent, Collections.emptyList(), "When do you open?");

        assertThat(reply).isEqualTo("We open at 9.");
        verify(client).completeChat(eq("gpt-4o"), anyString(), anyList(), any(), eq(Collections.emptyList()));
    }

    private static ConversationMessage message(ConversationMessage.Sender sender, String content) {
        return ConversationMessage.builder().agentId(1L).phoneNumber(KEY.getPhoneNumber())
                .sender(sender).content(content).build();
    }
}
