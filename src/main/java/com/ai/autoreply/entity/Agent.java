package com.ai.autoreply.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Tenant agent configuration. Written by the admin surface, read-only here.
 */
@Entity
@Table(name = "agents", indexes = {
    @Index(name = "idx_agents_instance_name", columnList = "instance_name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Agent {

    public enum Status {
        ONLINE,
        OFFLINE
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String prompt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.OFFLINE;

    @Column(name = "instance_name", nullable = false)
    private String instanceName;

    @Column(name = "messages_count", nullable = false)
    @Builder.Default
    private int messagesCount = 0;

    @Column(name = "audio_enabled", nullable = false)
    @Builder.Default
    private boolean audioEnabled = true;

    /** Answer audio messages with a synthesized voice note instead of text. */
    @Column(name = "audio_response_enabled", nullable = false)
    @Builder.Default
    private boolean audioResponseEnabled = false;

    @Column(name = "audio_response_voice", length = 50)
    @Builder.Default
    private String audioResponseVoice = "nova";

    @Column(name = "image_enabled", nullable = false)
    @Builder.Default
    private boolean imageEnabled = true;

    @Column(name = "document_enabled", nullable = false)
    @Builder.Default
    private boolean documentEnabled = true;

    @Column(name = "widget_enabled", nullable = false)
    @Builder.Default
    private boolean widgetEnabled = false;

    @Column(name = "ghost_mode", nullable = false)
    @Builder.Default
    private boolean ghostMode = false;

    /** Seconds the agent stays silent after an owner-authored message. */
    @Column(name = "takeover_timeout", nullable = false)
    @Builder.Default
    private int takeoverTimeout = 60;

    @Column(name = "inactivity_enabled", nullable = false)
    @Builder.Default
    private boolean inactivityEnabled = false;

    /** Minutes of user silence before the follow-up nudge. */
    @Column(name = "inactivity_timeout", nullable = false)
    @Builder.Default
    private int inactivityTimeout = 5;

    @Column(name = "inactivity_message", columnDefinition = "TEXT")
    @Builder.Default
    private String inactivityMessage = "Looks like you stepped away. I'm still here if you need anything! 👋";

    @Column(name = "operating_hours_enabled", nullable = false)
    @Builder.Default
    private boolean operatingHoursEnabled = false;

    @Column(name = "operating_hours_start")
    @Builder.Default
    private LocalTime operatingHoursStart = LocalTime.of(9, 0);

    @Column(name = "operating_hours_end")
    @Builder.Default
    private LocalTime operatingHoursEnd = LocalTime.of(18, 0);

    @Column(name = "operating_hours_timezone", length = 50)
    @Builder.Default
    private String operatingHoursTimezone = "America/Sao_Paulo";

    @Column(name = "out_of_hours_message", columnDefinition = "TEXT")
    @Builder.Default
    private String outOfHoursMessage = "Hi! We're available from 09:00 to 18:00. Leave your message and we'll get back to you as soon as possible! 🕐";

    /** Phone number that receives human-handoff notifications. */
    @Column(name = "notification_number", length = 50)
    private String transferNumber;

    @Column(name = "transfer_instructions", columnDefinition = "TEXT")
    private String transferInstructions;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "agent_required_field", joinColumns = @JoinColumn(name = "agent_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<RequiredField> requiredFields = new ArrayList<>();

    @Column(name = "openai_model", length = 100)
    private String openaiModel;

    @Column(name = "openai_api_key")
    private String openaiApiKey;

    @Column(name = "evolution_api_url", length = 500)
    private String evolutionApiUrl;

    @Column(name = "evolution_api_key")
    private String evolutionApiKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
