package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Resolved outreach treatment for a prospect.
 *
 * Rows are appended, never updated: the newest row per prospect is the current assignment and
 * the rest is the audit trail. The scoring inputs are stored next to the reason string.
 */
@Entity
@Table(name = "campaign_assignments",
       indexes = @Index(name = "idx_assignment_prospect", columnList = "tenantId, prospectId, assignedAt"))
@Data
@NoArgsConstructor
public class CampaignAssignment {

    @Id
    private String assignmentId;

    @Column(nullable = false, updatable = false)
    private String tenantId;

    @Column(nullable = false, updatable = false)
    private String prospectId;

    @Column(nullable = false, updatable = false)
    private String campaignId;

    @Column(nullable = false, updatable = false)
    private String sequenceId;

    @Column(nullable = false, updatable = false, precision = 6, scale = 2)
    private BigDecimal delayHours;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AssignmentPriority priority;

    @Column(nullable = false, updatable = false, length = 500)
    private String reason;

    @Column(nullable = false, updatable = false)
    private Integer leadScore;

    @Column(updatable = false, precision = 14, scale = 2)
    private BigDecimal roiPotential;

    @Column(nullable = false, updatable = false)
    private Integer opportunityCount;

    @Column(nullable = false, updatable = false)
    private Instant assignedAt;

    @PrePersist
    protected void onCreate() {
        if (assignedAt == null) {
            assignedAt = Instant.now();
        }
    }
}
