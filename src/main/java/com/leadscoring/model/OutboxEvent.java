package com.leadscoring.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Notifications produced by a recompute (new score, new assignment, stage change, reply
 * needing review) are written here in the SAME transaction as the ScoreRecord and
 * CampaignAssignment rows. OutboxEventPublisher later ships them to Kafka.
 *
 * So a committed recompute always has its notifications, and a rolled back recompute never
 * leaks one. Publishing is at-least-once; downstream consumers key on prospectId.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_outbox_published", columnList = "published"),
           @Index(name = "idx_outbox_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Prospect the notification is about. Used as the Kafka record key.
     */
    @Column(nullable = false)
    private String aggregateId;

    /**
     * Simple class name of the payload record, e.g. "ProspectStageChanged".
     */
    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
