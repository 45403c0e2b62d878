package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One immutable entry of the per-prospect engagement log.
 *
 * The log is append-only and is the only source for engagement scoring, temperature and
 * lead status: every recompute folds the whole log instead of applying deltas.
 *
 * The unique constraint on (tenantId, prospectId, externalActivityId) backs the duplicate check
 * in the collector, so a redelivered webhook can never be appended twice.
 */
@Entity
@Table(name = "engagement_events",
       uniqueConstraints = @UniqueConstraint(name = "uk_engagement_activity",
               columnNames = {"tenantId", "prospectId", "externalActivityId"}),
       indexes = {
           @Index(name = "idx_engagement_prospect", columnList = "tenantId, prospectId"),
           @Index(name = "idx_engagement_integration", columnList = "tenantId, integrationId")
       })
@Data
@NoArgsConstructor
public class EngagementEvent {

    @Id
    private String eventId;

    @Column(nullable = false, updatable = false)
    private String tenantId;

    @Column(nullable = false, updatable = false)
    private String prospectId;

    /**
     * Channel identity the activity came through (outreach integration / mailbox).
     */
    @Column(nullable = false, updatable = false)
    private String integrationId;

    @Column(nullable = false, updatable = false)
    private String externalActivityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ActivityKind kind;

    @Column(nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String replyContent;

    // Classification captured at collection time, REPLIED only
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private Sentiment replySentiment;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private ReplyIntent replyIntent;

    @Column(updatable = false)
    private Boolean needsHumanReview;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}
