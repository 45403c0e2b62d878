package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A company being evaluated for automation-service sales.
 *
 * Created on first sighting, mutated only by the lifecycle rules, never deleted here.
 * The stage field is the only mutable business field; scores live in {@link ScoreRecord}.
 * Prospect ids are only unique within a tenant, so the row key is a surrogate.
 */
@Entity
@Table(name = "prospects",
       uniqueConstraints = @UniqueConstraint(name = "uk_prospect_tenant", columnNames = {"tenantId", "prospectId"}))
@Data
@NoArgsConstructor
public class Prospect {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String prospectId;

    @Column(nullable = false, updatable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    private String industry;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CompanySize companySize = CompanySize.UNKNOWN;

    private String revenueBand;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProspectStage stage = ProspectStage.IDENTIFIED;

    private Instant stageChangedAt;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (stageChangedAt == null) {
            stageChangedAt = createdAt;
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
