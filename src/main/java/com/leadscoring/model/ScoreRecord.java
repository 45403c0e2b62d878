package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current derived scores for a prospect.
 *
 * Fully recomputable from the prospect record, its opportunities, snapshots and the engagement
 * log. Never edited by hand; every write comes from a recompute.
 */
@Entity
@Table(name = "score_records",
       uniqueConstraints = @UniqueConstraint(name = "uk_score_prospect", columnNames = {"tenantId", "prospectId"}))
@Data
@NoArgsConstructor
public class ScoreRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String prospectId;

    @Column(nullable = false, updatable = false)
    private String tenantId;

    @Column(nullable = false)
    private Integer leadScore;

    @Column(nullable = false)
    private Integer engagementScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Temperature temperature;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LeadStatus leadStatus;

    @Column(nullable = false)
    private Instant computedAt;

    @Version
    private Long version;
}
