package com.ai.autoreply.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Per-conversation timing state read by the policy gate and the inactivity sweeper.
 */
@Entity
@Table(name = "conversation_activity", uniqueConstraints = {
    @UniqueConstraint(name = "uk_conversation_activity_key", columnNames = {"agent_id", "phone_number"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false)
    private Long agentId;

    @Column(name = "phone_number", nullable = false, length = 50)
    private String phoneNumber;

    @Column(name = "last_user_message_at")
    private Instant lastUserMessageAt;

    @Column(name = "last_agent_message_at")
    private Instant lastAgentMessageAt;

    /** Reset whenever a new user message arrives. */
    @Column(name = "inactivity_message_sent", nullable = false)
    private boolean inactivityMessageSent;
}
