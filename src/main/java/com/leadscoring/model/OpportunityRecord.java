package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An identified manual process with an estimated automation ROI.
 * Read-only input to the opportunity and service-fit components of the lead score.
 */
@Entity
@Table(name = "opportunity_records",
       indexes = @Index(name = "idx_opportunity_prospect", columnList = "tenantId, prospectId"))
@Data
@NoArgsConstructor
public class OpportunityRecord {

    @Id
    private String opportunityId;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String prospectId;

    @Column(nullable = false)
    private String processName;

    // 1-100
    @Column(nullable = false)
    private Integer priorityScore;

    @Enumerated(EnumType.STRING)
    private ServiceTier serviceTier;

    // Estimated annual savings
    private BigDecimal roiEstimate;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
