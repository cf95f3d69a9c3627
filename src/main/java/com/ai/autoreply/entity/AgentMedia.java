package com.ai.autoreply.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog entry the model can push to a contact through {@code send_media}.
 * {@code fileUrls} and {@code mimeTypes} are index-aligned.
 */
@Entity
@Table(name = "agent_media", indexes = {
    @Index(name = "idx_agent_media_agent", columnList = "agent_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentMedia {

    public enum Type {
        IMAGE,
        GALLERY,
        VIDEO,
        DOCUMENT
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false)
    private Long agentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", nullable = false, length = 20)
    private Type type;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "agent_media_file", joinColumns = @JoinColumn(name = "media_id"))
    @OrderColumn(name = "position")
    @Column(name = "file_url", columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private List<String> fileUrls = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "agent_media_mime", joinColumns = @JoinColumn(name = "media_id"))
    @OrderColumn(name = "position")
    @Column(name = "mime_type", length = 100)
    @Builder.Default
    private List<String> mimeTypes = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public String mimeTypeAt(int index, String fallback) {
        if (mimeTypes == null || index >= mimeTypes.size()) return fallback;
        String mime = mimeTypes.get(index);
        return mime == null || mime.isBlank() ? fallback : mime;
    }
}
