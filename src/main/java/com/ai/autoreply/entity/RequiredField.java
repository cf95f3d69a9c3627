package com.ai.autoreply.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Customer detail that must be collected before a human handoff, with the question the agent asks for it.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RequiredField {

    @Column(name = "field_key", nullable = false, length = 100)
    private String key;

    @Column(columnDefinition = "TEXT")
    private String question;
}
