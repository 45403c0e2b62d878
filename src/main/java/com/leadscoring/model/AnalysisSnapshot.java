package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Versioned result of an external analysis pass (website, journey, ...).
 *
 * Immutable once written. Version is strictly increasing per prospect and analysis type;
 * scoring only looks at the latest version of each type.
 */
@Entity
@Table(name = "analysis_snapshots",
       uniqueConstraints = @UniqueConstraint(name = "uk_snapshot_version",
               columnNames = {"tenantId", "prospectId", "analysisType", "version"}),
       indexes = @Index(name = "idx_snapshot_prospect", columnList = "tenantId, prospectId"))
@Data
@NoArgsConstructor
public class AnalysisSnapshot {

    @Id
    private String snapshotId;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String prospectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AnalysisType analysisType;

    @Column(nullable = false, updatable = false)
    private Integer version;

    @Column(nullable = false, updatable = false)
    private Boolean completed;

    // 0-100 as reported by the analyser, informational only
    private Integer contentQualityScore;

    @Column(nullable = false, updatable = false)
    private Instant analyzedAt;

    @Column(nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }
}
