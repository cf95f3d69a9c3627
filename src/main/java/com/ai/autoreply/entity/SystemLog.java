package com.ai.autoreply.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Operator-facing audit trail of tool calls, media sends and failures.
 */
@Entity
@Table(name = "system_logs", indexes = {
    @Index(name = "idx_system_logs_agent", columnList = "agent_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemLog {

    public enum Type {
        TOOL_CALL,
        MEDIA_SEND,
        MEDIA_MATCH,
        ERROR,
        INFO,
        FAQ_MATCH
    }

    public enum Source {
        WHATSAPP,
        WIDGET
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id")
    private Long agentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_type", nullable = false, length = 20)
    private Type type;

    @Column(nullable = false, length = 500)
    private String action;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(name = "phone_number", length = 50)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Source source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
