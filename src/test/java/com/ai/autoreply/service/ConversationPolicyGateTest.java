package com.ai.autoreply.service;

import com.ai.autoreply.client.GatewayClient;
import com.ai.autoreply.client.GatewayClientFactory;
import com.ai.autoreply.component.ResponsePhrases;
import com.ai.autoreply.conversation.ContentKind;
import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.conversation.NormalizedContent;
import com.ai.autoreply.conversation.PolicyDecision;
import com.ai.autoreply.conversation.PolicyOutcome;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.ConversationTakeover;
import com.ai.autoreply.exception.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConversationPolicyGateTest {

    private static final Instant NOW = Instant.parse("2024-05-10T15:00:00Z");
    private static final ConversationKey KEY = ConversationKey.of(1L, "5511999990000");
    private static final NormalizedContent HELLO = NormalizedContent.text(ContentKind.TEXT, "hello");

    private ConversationStateService stateService;
    private GatewayClientFactory gatewayClientFactory;
    private GatewayClient gateway;
    private ConversationPolicyGate gate;
    private Agent agent;

    @BeforeEach
    void setUp() {
        stateService = mock(ConversationStateService.class);
        gatewayClientFactory = mock(GatewayClientFactory.class);
        gateway = mock(GatewayClient.class);
        when(gatewayClientFactory.forAgent(any())).thenReturn(gateway);
        when(stateService.appendUserMessage(eq(KEY), anyString(), anyBoolean()))
                .thenReturn(ConversationMessage.builder().id(42L).build());
        when(stateService.findTakeover(KEY)).thenReturn(Optional.empty());

        gate = new ConversationPolicyGate(stateService, gatewayClientFactory, mock(SystemLogService.class),
                new ResponsePhrases(), Clock.fixed(NOW, ZoneOffset.UTC), "America/Sao_Paulo");
        agent = Agent.builder().id(1L).name("Store").prompt("You are helpful").instanceName("store")
                .status(Agent.Status.ONLINE).operatingHoursTimezone("UTC").build();
    }

    @Test
    void ownerMessageIsStoredAndMarksTakeover() {
        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, true);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.OWNER_MESSAGE_STORED);
        verify(stateService).appendOwnerMessage(KEY, "hello");
        verify(stateService).markTakeover(KEY);
        verify(stateService, never()).appendUserMessage(any(), any(), anyBoolean());
        verify(stateService, never()).recordUserActivity(any());
        verifyNoInteractions(gateway);
    }

    @Test
    void ghostModeStoresWithoutReplying() {
        agent.setGhostMode(true);

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.GHOST_MODE);
        assertThat(decision.getUserMessageId()).isEqualTo(42L);
        verify(stateService).appendUserMessage(KEY, "hello", false);
        verify(stateService).recordUserActivity(KEY);
        verifyNoInteractions(gatewayClientFactory);
    }

    @Test
    void outsideOperatingHoursSendsOutOfHoursMessageVerbatim() {
        agent.setOperatingHoursEnabled(true);
        agent.setOperatingHoursStart(LocalTime.of(9, 0));
        agent.setOperatingHoursEnd(LocalTime.of(12, 0));
        agent.setOutOfHoursMessage("We are closed, back at 9!");

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.OUT_OF_HOURS);
        verify(gateway).sendText("store", KEY.getPhoneNumber(), "We are closed, back at 9!");
        verify(stateService).appendAgentMessage(KEY, "We are closed, back at 9!");
        verify(stateService).recordAgentActivity(KEY);
    }

    @Test
    void blankOutOfHoursMessageFallsBackToDefaultPhrase() {
        agent.setOperatingHoursEnabled(true);
        agent.setOperatingHoursStart(LocalTime.of(9, 0));
        agent.setOperatingHoursEnd(LocalTime.of(12, 0));
        agent.setOutOfHoursMessage("  ");
        String expected = new ResponsePhrases().outOfHoursDefault();

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.OUT_OF_HOURS);
        verify(gateway).sendText("store", KEY.getPhoneNumber(), expected);
        verify(stateService).appendAgentMessage(KEY, expected);
    }

    @Test
    void outOfHoursSendFailureIsNotPersisted() {
        agent.setOperatingHoursEnabled(true);
        agent.setOperatingHoursStart(LocalTime.of(9, 0));
        agent.setOperatingHoursEnd(LocalTime.of(12, 0));
        doThrow(new GatewayException("down")).when(gateway).sendText(anyString(), anyString(), anyString());

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.OUT_OF_HOURS);
        verify(stateService, never()).appendAgentMessage(any(), any());
    }

    @Test
    void insideOperatingHoursProceeds() {
        agent.setOperatingHoursEnabled(true);
        agent.setOperatingHoursStart(LocalTime.of(9, 0));
        agent.setOperatingHoursEnd(LocalTime.of(18, 0));

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.shouldProceed()).isTrue();
        assertThat(decision.getUserMessageId()).isEqualTo(42L);
        verifyNoInteractions(gateway);
    }

    @Test
    void operatingHoursAreEvaluatedInAgentTimezone() {
        agent.setOperatingHoursStart(LocalTime.of(9, 0));
        agent.setOperatingHoursEnd(LocalTime.of(18, 0));
        agent.setOperatingHoursTimezone("Asia/Tokyo");

        // 15:00 UTC is 00:00 in Tokyo
        assertThat(gate.isWithinOperatingHours(agent, NOW)).isFalse();
    }

    @Test
    void overnightWindowWrapsMidnight() {
        agent.setOperatingHoursStart(LocalTime.of(22, 0));
        agent.setOperatingHoursEnd(LocalTime.of(6, 0));

        assertThat(gate.isWithinOperatingHours(agent, Instant.parse("2024-05-10T23:30:00Z"))).isTrue();
        assertThat(gate.isWithinOperatingHours(agent, Instant.parse("2024-05-10T05:59:30Z"))).isTrue();
        assertThat(gate.isWithinOperatingHours(agent, Instant.parse("2024-05-10T06:00:00Z"))).isFalse();
        assertThat(gate.isWithinOperatingHours(agent, NOW)).isFalse();
    }

    @Test
    void activeTakeoverReportsRemainingSeconds() {
        agent.setTakeoverTimeout(60);
        when(stateService.findTakeover(KEY)).thenReturn(Optional.of(takeoverAt(NOW.minusSeconds(30))));

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.getOutcome()).isEqualTo(PolicyOutcome.TAKEOVER_ACTIVE);
        assertThat(decision.getRemainingSeconds()).isEqualTo(30L);
        verify(stateService).appendUserMessage(KEY, "hello", false);
        verify(stateService, never()).clearTakeover(any());
        verifyNoInteractions(gateway);
    }

    @Test
    void expiredTakeoverIsClearedAndAgentResumes() {
        agent.setTakeoverTimeout(60);
        when(stateService.findTakeover(KEY)).thenReturn(Optional.of(takeoverAt(NOW.minusSeconds(65))));

        PolicyDecision decision = gate.evaluate(agent, KEY, HELLO, false);

        assertThat(decision.shouldProceed()).isTrue();
        verify(stateService).clearTakeover(KEY);
    }

    @Test
    void audioFlagIsPersisted() {
        gate.evaluate(agent, KEY, NormalizedContent.text(ContentKind.AUDIO, "transcript"), false);

        verify(stateService).appendUserMessage(KEY, "transcript", true);
    }

    private static ConversationTakeover takeoverAt(Instant at) {
        return ConversationTakeover.builder().agentId(KEY.getAgentId()).phoneNumber(KEY.getPhoneNumber())
                .takenOverAt(at).build();
    }
}
