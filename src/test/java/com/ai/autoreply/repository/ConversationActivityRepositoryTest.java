package com.ai.autoreply.repository;

import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.entity.Agent;
import com.ai.autoreply.entity.ConversationActivity;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.RequiredField;
import com.ai.autoreply.service.ConversationStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import({ConversationStateService.class, ConversationActivityRepositoryTest.ClockConfig.class})
class ConversationActivityRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-10T15:00:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        Clock testClock() {
            return mock(Clock.class);
        }
    }

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ConversationStateService stateService;

    @Autowired
    private ConversationActivityRepository activityRepository;

    @Autowired
    private Clock clock;

    private Agent agent;
    private ConversationKey key;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(T0);
        agent = entityManager.persistAndFlush(Agent.builder()
                .name("Store")
                .prompt("You are the store assistant.")
                .instanceName("store")
                .status(Agent.Status.ONLINE)
                .build());
        key = ConversationKey.of(agent.getId(), "5511999990000");
    }

    @Test
    void historyIsChronologicalAndExcludesCurrentMessage() {
        stateService.appendUserMessage(key, "hi", false);
        stateService.appendAgentMessage(key, "hello!");
        ConversationMessage current = stateService.appendUserMessage(key, "price?", false);

        List<ConversationMessage> history = stateService.recentHistory(key, current.getId(), 10);
        assertThat(history).extracting(ConversationMessage::getContent).containsExactly("hi", "hello!");

        List<ConversationMessage> lastOne = stateService.recentHistory(key, null, 1);
        assertThat(lastOne).extracting(ConversationMessage::getContent).containsExactly("price?");

        entityManager.clear();
        assertThat(entityManager.find(Agent.class, agent.getId()).getMessagesCount()).isEqualTo(3);
    }

    @Test
    void ownerMessagesAreFlagged() {
        ConversationMessage owner = stateService.appendOwnerMessage(key, "I'll take it from here");

        assertThat(owner.isFromOwner()).isTrue();
        assertThat(owner.getSender()).isEqualTo(ConversationMessage.Sender.OWNER);
        assertThat(owner.getStatus()).isEqualTo(ConversationStateService.STATUS_SENT);
    }

    @Test
    void activityIsUpsertedAndUserMessageReArmsNudge() {
        stateService.recordUserActivity(key);
        when(clock.instant()).thenReturn(T0.plusSeconds(10));
        stateService.recordAgentActivity(key);

        ConversationActivity activity = stateService.findActivity(key).orElseThrow();
        assertThat(activity.getLastUserMessageAt()).isEqualTo(T0);
        assertThat(activity.getLastAgentMessageAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(activityRepository.count()).isEqualTo(1);

        assertThat(activityRepository.claimInactivityMessage(activity.getId())).isEqualTo(1);
        when(clock.instant()).thenReturn(T0.plusSeconds(20));
        stateService.recordUserActivity(key);

        ConversationActivity reset = stateService.findActivity(key).orElseThrow();
        assertThat(reset.isInactivityMessageSent()).isFalse();
        assertThat(reset.getLastUserMessageAt()).isEqualTo(T0.plusSeconds(20));
    }

    @Test
    void findsConversationsAwaitingFollowUp() {
        stateService.recordUserActivity(key);
        when(clock.instant()).thenReturn(T0.plusSeconds(5));
        stateService.recordAgentActivity(key);

        ConversationKey answeredByUser = ConversationKey.of(agent.getId(), "5511777770000");
        when(clock.instant()).thenReturn(T0);
        stateService.recordAgentActivity(answeredByUser);
        when(clock.instant()).thenReturn(T0.plusSeconds(5));
        stateService.recordUserActivity(answeredByUser);

        List<ConversationActivity> due = activityRepository.findAwaitingFollowUp(agent.getId(), T0.plusSeconds(60));
        assertThat(due).extracting(ConversationActivity::getPhoneNumber).containsExactly("5511999990000");

        assertThat(activityRepository.findAwaitingFollowUp(agent.getId(), T0)).isEmpty();
    }

    @Test
    void inactivityClaimSucceedsOnlyOnce() {
        stateService.recordUserActivity(key);
        Long id = stateService.findActivity(key).orElseThrow().getId();

        assertThat(activityRepository.claimInactivityMessage(id)).isEqualTo(1);
        assertThat(activityRepository.claimInactivityMessage(id)).isZero();

        activityRepository.releaseInactivityMessage(id);
        assertThat(activityRepository.claimInactivityMessage(id)).isEqualTo(1);
    }

    @Test
    void takeoverIsCreatedRefreshedAndCleared() {
        stateService.markTakeover(key);
        when(clock.instant()).thenReturn(T0.plusSeconds(30));
        stateService.markTakeover(key);

        assertThat(stateService.findTakeover(key)).get()
                .extracting(t -> t.getTakenOverAt())
                .isEqualTo(T0.plusSeconds(30));
        assertThat(entityManager.getEntityManager()
                .createQuery("SELECT COUNT(t) FROM ConversationTakeover t", Long.class)
                .getSingleResult()).isEqualTo(1L);

        stateService.clearTakeover(key);
        assertThat(stateService.findTakeover(key)).isEmpty();
    }

    @Test
    void collectedFieldsAreUpsertedPerContact() {
        stateService.recordCollectedField(key, "name", "Ana");
        stateService.recordCollectedField(key, "address", "Rua A, 10");
        when(clock.instant()).thenReturn(T0.plusSeconds(30));
        stateService.recordCollectedField(key, "name", "Ana Souza");
        stateService.recordCollectedField(ConversationKey.of(agent.getId(), "5511777770000"), "name", "Bruno");

        assertThat(stateService.collectedData(key))
                .containsExactly(Map.entry("name", "Ana Souza"), Map.entry("address", "Rua A, 10"));
    }

    @Test
    void requiredFieldsKeepTheirOrder() {
        agent.setRequiredFields(new ArrayList<>(List.of(new RequiredField("name", "What's your name?"),
                new RequiredField("document", "What's your CPF?"))));
        entityManager.persistAndFlush(agent);
        entityManager.clear();

        assertThat(entityManager.find(Agent.class, agent.getId()).getRequiredFields())
                .extracting(RequiredField::getKey)
                .containsExactly("name", "document");
    }
}
