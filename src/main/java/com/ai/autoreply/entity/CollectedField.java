package com.ai.autoreply.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One value the model recorded about a contact through {@code collect_customer_info}. Later values replace earlier ones.
 */
@Entity
@Table(name = "contact_collected_data", uniqueConstraints = {
    @UniqueConstraint(name = "uk_contact_collected_data_key", columnNames = {"agent_id", "phone_number", "field_key"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CollectedField {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false)
    private Long agentId;

    @Column(name = "phone_number", nullable = false, length = 50)
    private String phoneNumber;

    @Column(name = "field_key", nullable = false, length = 100)
    private String fieldKey;

    @Column(name = "field_value", columnDefinition = "TEXT", nullable = false)
    private String fieldValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
