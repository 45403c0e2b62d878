package com.leadscoring.collector;

import com.leadscoring.classifier.ReplyClassification;
import com.leadscoring.classifier.ReplyClassifier;
import com.leadscoring.config.KafkaTopics;
import com.leadscoring.event.ActivitySignal;
import com.leadscoring.event.AnalysisSignal;
import com.leadscoring.event.RecomputeRequest;
import com.leadscoring.event.ReplyReviewRequested;
import com.leadscoring.exception.SignalValidationException;
import com.leadscoring.model.ActivityKind;
import com.leadscoring.model.AnalysisSnapshot;
import com.leadscoring.model.AnalysisType;
import com.leadscoring.model.EngagementEvent;
import com.leadscoring.repository.AnalysisSnapshotRepository;
import com.leadscoring.repository.EngagementEventRepository;
import com.leadscoring.repository.ProspectRepository;
import com.leadscoring.service.OutboxEventWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * SIGNAL COLLECTOR
 * ================
 *
 * Single entry point for raw engagement activity and analysis results.
 *
 * RESPONSIBILITIES:
 * -----------------
 * 1. Validate the signal (required fields, known kind / analysis type, known prospect)
 * 2. Drop duplicates (same external activity id, same snapshot version) as no-ops
 * 3. Classify reply text once, at collection time
 * 4. Append exactly one immutable record and hand back a RecomputeRequest
 * 5. For replies that need a human, write the ReplyReviewRequested outbox row in the same
 *    transaction as the reply itself
 *
 * Scores, temperature, status and stage are never touched here; that is the recompute's job,
 * so a collector failure can never leave half-updated scores.
 *
 * A concurrent duplicate that slips past the existence check fails on the unique constraint
 * at commit; SignalIngestionService treats that as a duplicate too.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalCollector {

    static final String COMPONENT = "SignalCollector";

    private final ProspectRepository prospectRepository;
    private final EngagementEventRepository engagementEventRepository;
    private final AnalysisSnapshotRepository snapshotRepository;
    private final OutboxEventWriter outboxEventWriter;
    private final ReplyClassifier replyClassifier;
    private final Clock clock;

    // ==================== ENGAGEMENT ACTIVITY ====================

    @Transactional
    public CollectionResult collectActivity(ActivitySignal signal) {
        if (signal == null) {
            throw new SignalValidationException(COMPONENT, null, "Activity signal is required");
        }
        String prospectId = signal.prospectId();
        requireText(signal.tenantId(), "tenantId", prospectId);
        requireText(prospectId, "prospectId", prospectId);
        requireText(signal.integrationId(), "integrationId", prospectId);
        requireText(signal.externalActivityId(), "externalActivityId", prospectId);
        if (signal.occurredAt() == null) {
            throw new SignalValidationException(COMPONENT, prospectId, "occurredAt is required");
        }
        ActivityKind kind = ActivityKind.fromValue(signal.kind())
                .orElseThrow(() -> new SignalValidationException(COMPONENT, prospectId,
                        "Unknown activity kind: " + signal.kind()));

        requireKnownProspect(signal.tenantId(), prospectId);

        if (engagementEventRepository.existsByTenantIdAndProspectIdAndExternalActivityId(
                signal.tenantId(), prospectId, signal.externalActivityId())) {
            log.info("Duplicate activity {} for prospect {}, ignoring", signal.externalActivityId(), prospectId);
            return CollectionResult.duplicateSignal();
        }

        EngagementEvent event = new EngagementEvent();
        event.setEventId(UUID.randomUUID().toString());
        event.setTenantId(signal.tenantId());
        event.setProspectId(prospectId);
        event.setIntegrationId(signal.integrationId());
        event.setExternalActivityId(signal.externalActivityId());
        event.setKind(kind);
        event.setOccurredAt(signal.occurredAt());
        event.setReceivedAt(Instant.now(clock));

        RecomputeRequest recompute = new RecomputeRequest(
                signal.tenantId(), prospectId, RecomputeRequest.Trigger.ENGAGEMENT_EVENT);

        if (kind == ActivityKind.REPLIED) {
            String content = signal.replyContent() == null ? null : signal.replyContent().trim();
            ReplyClassification classification = replyClassifier.classify(content);
            event.setReplyContent(content);
            event.setReplySentiment(classification.sentiment());
            event.setReplyIntent(classification.intent());
            event.setNeedsHumanReview(classification.needsHumanReview());
            engagementEventRepository.save(event);

            log.info("Collected reply {} for prospect {}: sentiment={}, intent={}",
                     signal.externalActivityId(), prospectId, classification.sentiment(), classification.intent());
            if (classification.needsHumanReview()) {
                requestReview(signal, classification);
            }
            return CollectionResult.appendedReply(event.getEventId(), recompute, classification);
        }

        engagementEventRepository.save(event);
        log.info("Collected {} activity {} for prospect {}", kind, signal.externalActivityId(), prospectId);
        return CollectionResult.appended(event.getEventId(), recompute);
    }

    private void requestReview(ActivitySignal signal, ReplyClassification classification) {
        outboxEventWriter.enqueue(KafkaTopics.REPLY_REVIEW, signal.prospectId(), new ReplyReviewRequested(
                signal.tenantId(), signal.prospectId(), signal.externalActivityId(),
                classification.sentiment(), classification.intent(), Instant.now(clock)));
        log.info("Reply {} of prospect {} flagged for human review ({})",
                 signal.externalActivityId(), signal.prospectId(), classification.intent());
    }

    // ==================== ANALYSIS SNAPSHOTS ====================

    @Transactional
    public CollectionResult collectAnalysis(AnalysisSignal signal) {
        if (signal == null) {
            throw new SignalValidationException(COMPONENT, null, "Analysis signal is required");
        }
        String prospectId = signal.prospectId();
        requireText(signal.tenantId(), "tenantId", prospectId);
        requireText(prospectId, "prospectId", prospectId);
        AnalysisType type = AnalysisType.fromValue(signal.analysisType())
                .orElseThrow(() -> new SignalValidationException(COMPONENT, prospectId,
                        "Unknown analysis type: " + signal.analysisType()));
        if (signal.version() == null || signal.version() < 1) {
            throw new SignalValidationException(COMPONENT, prospectId, "version must be a positive integer");
        }
        if (signal.analyzedAt() == null) {
            throw new SignalValidationException(COMPONENT, prospectId, "analyzedAt is required");
        }
        if (signal.contentQualityScore() != null
                && (signal.contentQualityScore() < 0 || signal.contentQualityScore() > 100)) {
            throw new SignalValidationException(COMPONENT, prospectId, "contentQualityScore must be within 0..100");
        }

        requireKnownProspect(signal.tenantId(), prospectId);

        Optional<AnalysisSnapshot> latest = snapshotRepository
                .findFirstByTenantIdAndProspectIdAndAnalysisTypeOrderByVersionDesc(signal.tenantId(), prospectId, type);
        if (latest.isPresent()) {
            int latestVersion = latest.get().getVersion();
            if (signal.version() == latestVersion) {
                log.info("Duplicate {} snapshot v{} for prospect {}, ignoring", type, latestVersion, prospectId);
                return CollectionResult.duplicateSignal();
            }
            if (signal.version() < latestVersion) {
                throw new SignalValidationException(COMPONENT, prospectId, String.format(
                        "Stale %s snapshot version %d, latest is %d", type, signal.version(), latestVersion));
            }
        }

        Instant now = Instant.now(clock);
        AnalysisSnapshot snapshot = new AnalysisSnapshot();
        snapshot.setSnapshotId(UUID.randomUUID().toString());
        snapshot.setTenantId(signal.tenantId());
        snapshot.setProspectId(prospectId);
        snapshot.setAnalysisType(type);
        snapshot.setVersion(signal.version());
        snapshot.setCompleted(completedFlag(type, signal.completed()));
        snapshot.setContentQualityScore(signal.contentQualityScore());
        snapshot.setAnalyzedAt(signal.analyzedAt());
        snapshot.setRecordedAt(now);
        snapshotRepository.save(snapshot);

        log.info("Collected {} snapshot v{} for prospect {} (completed={})",
                 type, signal.version(), prospectId, snapshot.getCompleted());
        return CollectionResult.appended(snapshot.getSnapshotId(),
                new RecomputeRequest(signal.tenantId(), prospectId, RecomputeRequest.Trigger.ANALYSIS_SNAPSHOT));
    }

    /**
     * Website analysis has to say it finished. The other analysers only report once they are
     * done, so a missing flag means completed.
     */
    static boolean completedFlag(AnalysisType type, Boolean reported) {
        if (reported != null) {
            return reported;
        }
        return type != AnalysisType.WEBSITE;
    }

    private void requireKnownProspect(String tenantId, String prospectId) {
        if (!prospectRepository.existsByTenantIdAndProspectId(tenantId, prospectId)) {
            throw new SignalValidationException(COMPONENT, prospectId,
                    "Unknown prospect " + prospectId + " for tenant " + tenantId);
        }
    }

    private static void requireText(String value, String field, String prospectId) {
        if (value == null || value.isBlank()) {
            throw new SignalValidationException(COMPONENT, prospectId, field + " is required");
        }
    }
}
