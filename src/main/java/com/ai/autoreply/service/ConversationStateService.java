package com.ai.autoreply.service;

import com.ai.autoreply.conversation.ConversationKey;
import com.ai.autoreply.entity.CollectedField;
import com.ai.autoreply.entity.ConversationActivity;
import com.ai.autoreply.entity.ConversationMessage;
import com.ai.autoreply.entity.ConversationTakeover;
import com.ai.autoreply.repository.AgentRepository;
import com.ai.autoreply.repository.CollectedFieldRepository;
import com.ai.autoreply.repository.ConversationActivityRepository;
import com.ai.autoreply.repository.ConversationMessageRepository;
import com.ai.autoreply.repository.ConversationTakeoverRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Message log, activity timestamps and takeover marks for every conversation.
 * Row creation is update-then-insert; a unique-key race on insert falls back to the update.
 */
@Service
public class ConversationStateService {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateService.class);

    public static final String STATUS_RECEIVED = "received";
    public static final String STATUS_SENT = "sent";

    private final ConversationMessageRepository messageRepository;
    private final ConversationActivityRepository activityRepository;
    private final ConversationTakeoverRepository takeoverRepository;
    private final CollectedFieldRepository collectedFieldRepository;
    private final AgentRepository agentRepository;
    private final Clock clock;

    public ConversationStateService(ConversationMessageRepository messageRepository,
                                    ConversationActivityRepository activityRepository,
                                    ConversationTakeoverRepository takeoverRepository,
                                    CollectedFieldRepository collectedFieldRepository,
                                    AgentRepository agentRepository,
                                    Clock clock) {
        this.messageRepository = messageRepository;
        this.activityRepository = activityRepository;
        this.takeoverRepository = takeoverRepository;
        this.collectedFieldRepository = collectedFieldRepository;
        this.agentRepository = agentRepository;
        this.clock = clock;
    }

    public ConversationMessage appendUserMessage(ConversationKey key, String content, boolean audio) {
        return append(key, ConversationMessage.Sender.USER, content, STATUS_RECEIVED, audio);
    }

    public ConversationMessage appendOwnerMessage(ConversationKey key, String content) {
        return append(key, ConversationMessage.Sender.OWNER, content, STATUS_SENT, false);
    }

    public ConversationMessage appendAgentMessage(ConversationKey key, String content) {
        return append(key, ConversationMessage.Sender.AGENT, content, STATUS_SENT, false);
    }

    private ConversationMessage append(ConversationKey key, ConversationMessage.Sender sender, String content,
                                       String status, boolean audio) {
        Instant now = clock.instant();
        ConversationMessage message = messageRepository.save(ConversationMessage.builder()
                .agentId(key.getAgentId())
                .phoneNumber(key.getPhoneNumber())
                .sender(sender)
                .content(content)
                .status(status)
                .audio(audio)
                .fromOwner(sender == ConversationMessage.Sender.OWNER)
                .createdAt(now)
                .build());
        agentRepository.incrementMessagesCount(key.getAgentId(), now);
        log.info("[{}] {}: {}", key, sender, content);
        return message;
    }

    /**
     * Last {@code limit} messages in chronological order, excluding {@code excludedMessageId} when given.
     */
    public List<ConversationMessage> recentHistory(ConversationKey key, Long excludedMessageId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        PageRequest page = PageRequest.of(0, limit);
        List<ConversationMessage> newestFirst = excludedMessageId != null
                ? messageRepository.findByAgentIdAndPhoneNumberAndIdNotOrderByIdDesc(
                        key.getAgentId(), key.getPhoneNumber(), excludedMessageId, page)
                : messageRepository.findByAgentIdAndPhoneNumberOrderByIdDesc(
                        key.getAgentId(), key.getPhoneNumber(), page);
        List<ConversationMessage> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    /** Sets lastUserMessageAt and re-arms the inactivity nudge. */
    public void recordUserActivity(ConversationKey key) {
        Instant now = clock.instant();
        upsert(key, "activity",
                () -> activityRepository.touchUserMessage(key.getAgentId(), key.getPhoneNumber(), now) > 0,
                () -> activityRepository.saveAndFlush(ConversationActivity.builder()
                        .agentId(key.getAgentId())
                        .phoneNumber(key.getPhoneNumber())
                        .lastUserMessageAt(now)
                        .inactivityMessageSent(false)
                        .build()));
    }

    public void recordAgentActivity(ConversationKey key) {
        Instant now = clock.instant();
        upsert(key, "activity",
                () -> activityRepository.touchAgentMessage(key.getAgentId(), key.getPhoneNumber(), now) > 0,
                () -> activityRepository.saveAndFlush(ConversationActivity.builder()
                        .agentId(key.getAgentId())
                        .phoneNumber(key.getPhoneNumber())
                        .lastAgentMessageAt(now)
                        .inactivityMessageSent(false)
                        .build()));
    }

    public Optional<ConversationActivity> findActivity(ConversationKey key) {
        return activityRepository.findByAgentIdAndPhoneNumber(key.getAgentId(), key.getPhoneNumber());
    }

    /** Creates or refreshes the takeover mark with {@code takenOverAt = now}. */
    public void markTakeover(ConversationKey key) {
        Instant now = clock.instant();
        upsert(key, "takeover",
                () -> takeoverRepository.refresh(key.getAgentId(), key.getPhoneNumber(), now) > 0,
                () -> takeoverRepository.saveAndFlush(ConversationTakeover.builder()
                        .agentId(key.getAgentId())
                        .phoneNumber(key.getPhoneNumber())
                        .takenOverAt(now)
                        .build()));
        log.info("[{}] Owner takeover marked", key);
    }

    public Optional<ConversationTakeover> findTakeover(ConversationKey key) {
        return takeoverRepository.findByAgentIdAndPhoneNumber(key.getAgentId(), key.getPhoneNumber());
    }

    public void clearTakeover(ConversationKey key) {
        int removed = takeoverRepository.deleteByConversation(key.getAgentId(), key.getPhoneNumber());
        if (removed > 0) {
            log.info("[{}] Takeover expired, agent resumes", key);
        }
    }

    /** Customer details recorded so far, keyed by field in the order they were first collected. */
    public Map<String, String> collectedData(ConversationKey key) {
        Map<String, String> data = new LinkedHashMap<>();
        for (CollectedField field : collectedFieldRepository.findByAgentIdAndPhoneNumberOrderByIdAsc(
                key.getAgentId(), key.getPhoneNumber())) {
            data.put(field.getFieldKey(), field.getFieldValue());
        }
        return data;
    }

    public void recordCollectedField(ConversationKey key, String fieldKey, String value) {
        Instant now = clock.instant();
        upsert(key, "collected field",
                () -> collectedFieldRepository.updateValue(key.getAgentId(), key.getPhoneNumber(), fieldKey, value, now) > 0,
                () -> collectedFieldRepository.saveAndFlush(CollectedField.builder()
                        .agentId(key.getAgentId())
                        .phoneNumber(key.getPhoneNumber())
                        .fieldKey(fieldKey)
                        .fieldValue(value)
                        .updatedAt(now)
                        .build()));
        log.info("[{}] Collected {}", key, fieldKey);
    }

    private void upsert(ConversationKey key, String what, BooleanSupplier update, Runnable insert) {
        if (update.getAsBoolean()) {
            return;
        }
        try {
            insert.run();
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Concurrent {} insert, retrying as update", key, what);
            if (!update.getAsBoolean()) {
                throw e;
            }
        }
    }
}
