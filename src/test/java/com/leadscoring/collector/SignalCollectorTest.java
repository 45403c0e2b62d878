package com.leadscoring.collector;

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
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;
import com.leadscoring.repository.AnalysisSnapshotRepository;
import com.leadscoring.repository.EngagementEventRepository;
import com.leadscoring.repository.ProspectRepository;
import com.leadscoring.service.OutboxEventWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static com.leadscoring.Fixtures.CLOCK;
import static com.leadscoring.Fixtures.INTEGRATION;
import static com.leadscoring.Fixtures.NOW;
import static com.leadscoring.Fixtures.PROSPECT;
import static com.leadscoring.Fixtures.TENANT;
import static com.leadscoring.Fixtures.daysAgo;
import static com.leadscoring.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalCollectorTest {

    @Mock
    private ProspectRepository prospectRepository;

    @Mock
    private EngagementEventRepository engagementEventRepository;

    @Mock
    private AnalysisSnapshotRepository snapshotRepository;

    @Mock
    private OutboxEventWriter outboxEventWriter;

    private SignalCollector collector;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        collector = new SignalCollector(prospectRepository, engagementEventRepository, snapshotRepository,
                outboxEventWriter, new ReplyClassifier(), CLOCK);

        when(prospectRepository.existsByTenantIdAndProspectId(TENANT, PROSPECT)).thenReturn(true);
    }

    // ========== Activity ==========

    @Test
    @DisplayName("Valid activity is appended and requests a recompute")
    void testCollectActivity() {
        CollectionResult result = collector.collectActivity(activity("msg-1", "Opened", null));

        ArgumentCaptor<EngagementEvent> saved = ArgumentCaptor.forClass(EngagementEvent.class);
        verify(engagementEventRepository).save(saved.capture());
        assertEquals(ActivityKind.OPENED, saved.getValue().getKind(), "Kind is parsed case-insensitively");
        assertEquals(NOW, saved.getValue().getReceivedAt());
        assertNull(saved.getValue().getReplySentiment());

        assertTrue(result.isAppended());
        assertEquals(saved.getValue().getEventId(), result.recordId());
        assertEquals(Optional.of(new RecomputeRequest(TENANT, PROSPECT, RecomputeRequest.Trigger.ENGAGEMENT_EVENT)),
                result.recompute());
        assertTrue(result.classification().isEmpty());
    }

    @Test
    @DisplayName("Replies are classified once and the result is stored on the event")
    void testCollectReply() {
        CollectionResult result = collector.collectActivity(
                activity("msg-2", "replied", "  Can we schedule a call next week?  "));

        ArgumentCaptor<EngagementEvent> saved = ArgumentCaptor.forClass(EngagementEvent.class);
        verify(engagementEventRepository).save(saved.capture());
        assertEquals("Can we schedule a call next week?", saved.getValue().getReplyContent());
        assertEquals(Sentiment.POSITIVE, saved.getValue().getReplySentiment());
        assertEquals(ReplyIntent.MEETING_REQUEST, saved.getValue().getReplyIntent());
        assertTrue(saved.getValue().getNeedsHumanReview());

        assertTrue(result.classification().isPresent());
        assertTrue(result.classification().get().needsHumanReview());
    }

    @Test
    @DisplayName("Reply needing review queues the review request alongside the reply")
    void testReplyReviewQueued() {
        collector.collectActivity(activity("msg-3", "replied", "Happy to set up some meetings"));

        ArgumentCaptor<Object> queued = ArgumentCaptor.forClass(Object.class);
        verify(outboxEventWriter).enqueue(eq(KafkaTopics.REPLY_REVIEW), eq(PROSPECT), queued.capture());
        ReplyReviewRequested review = (ReplyReviewRequested) queued.getValue();
        assertEquals(TENANT, review.tenantId());
        assertEquals("msg-3", review.externalActivityId());
        assertEquals(ReplyIntent.MEETING_REQUEST, review.intent());
        assertEquals(NOW, review.timestamp());
    }

    @Test
    @DisplayName("Replies and activities that need no review queue nothing")
    void testNoReviewQueued() {
        collector.collectActivity(activity("msg-4", "replied", "Please remove me from this list"));
        collector.collectActivity(activity("msg-5", "clicked", null));

        verify(outboxEventWriter, never()).enqueue(any(), any(), any());
    }

    @Test
    @DisplayName("Duplicate reply queues no second review")
    void testDuplicateReplyNoReview() {
        when(engagementEventRepository.existsByTenantIdAndProspectIdAndExternalActivityId(TENANT, PROSPECT, "msg-6"))
                .thenReturn(true);

        collector.collectActivity(activity("msg-6", "replied", "Interested, let's schedule a demo"));

        verify(outboxEventWriter, never()).enqueue(any(), any(), any());
    }

    @Test
    @DisplayName("Redelivered activity is a no-op")
    void testDuplicateActivity() {
        when(engagementEventRepository.existsByTenantIdAndProspectIdAndExternalActivityId(TENANT, PROSPECT, "msg-1"))
                .thenReturn(true);

        CollectionResult result = collector.collectActivity(activity("msg-1", "opened", null));

        assertTrue(result.duplicate());
        assertTrue(result.recompute().isEmpty());
        verify(engagementEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unknown activity kind is rejected")
    void testUnknownKind() {
        SignalValidationException e = assertThrows(SignalValidationException.class,
                () -> collector.collectActivity(activity("msg-1", "forwarded", null)));

        assertEquals(PROSPECT, e.getSubjectId());
        assertEquals("SignalCollector", e.getComponent());
        verify(engagementEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Missing fields are rejected")
    void testMissingFields() {
        assertThrows(SignalValidationException.class, () -> collector.collectActivity(null));
        assertThrows(SignalValidationException.class, () -> collector.collectActivity(
                new ActivitySignal(TENANT, PROSPECT, INTEGRATION, " ", "opened", NOW, null)));
        assertThrows(SignalValidationException.class, () -> collector.collectActivity(
                new ActivitySignal(TENANT, PROSPECT, null, "msg-1", "opened", NOW, null)));
        assertThrows(SignalValidationException.class, () -> collector.collectActivity(
                new ActivitySignal(TENANT, PROSPECT, INTEGRATION, "msg-1", "opened", null, null)));
    }

    @Test
    @DisplayName("Activity for an unknown prospect is rejected")
    void testUnknownProspect() {
        SignalValidationException e = assertThrows(SignalValidationException.class, () -> collector.collectActivity(
                new ActivitySignal(TENANT, "p-missing", INTEGRATION, "msg-1", "opened", NOW, null)));

        assertEquals("p-missing", e.getSubjectId());
    }

    // ========== Analysis ==========

    @Test
    @DisplayName("First snapshot of a type is appended")
    void testCollectAnalysis() {
        when(snapshotRepository.findFirstByTenantIdAndProspectIdAndAnalysisTypeOrderByVersionDesc(
                TENANT, PROSPECT, AnalysisType.WEBSITE)).thenReturn(Optional.empty());

        CollectionResult result = collector.collectAnalysis(analysis("website", 1, true));

        ArgumentCaptor<AnalysisSnapshot> saved = ArgumentCaptor.forClass(AnalysisSnapshot.class);
        verify(snapshotRepository).save(saved.capture());
        assertEquals(AnalysisType.WEBSITE, saved.getValue().getAnalysisType());
        assertTrue(saved.getValue().getCompleted());
        assertEquals(RecomputeRequest.Trigger.ANALYSIS_SNAPSHOT, result.recompute().orElseThrow().trigger());
    }

    @Test
    @DisplayName("Same version again is a duplicate, lower version is stale")
    void testSnapshotVersions() {
        when(snapshotRepository.findFirstByTenantIdAndProspectIdAndAnalysisTypeOrderByVersionDesc(
                TENANT, PROSPECT, AnalysisType.CUSTOMER_JOURNEY))
                .thenReturn(Optional.of(snapshot(AnalysisType.CUSTOMER_JOURNEY, 3, true)));

        assertTrue(collector.collectAnalysis(analysis("customer_journey", 3, true)).duplicate());
        assertThrows(SignalValidationException.class,
                () -> collector.collectAnalysis(analysis("customer_journey", 2, true)));
        assertTrue(collector.collectAnalysis(analysis("customer_journey", 4, true)).isAppended());
    }

    @Test
    @DisplayName("Missing completed flag: website is incomplete, other types count as present")
    void testCompletedDefault() {
        assertFalse(SignalCollector.completedFlag(AnalysisType.WEBSITE, null));
        assertTrue(SignalCollector.completedFlag(AnalysisType.ROI_PROJECTION, null));
        assertFalse(SignalCollector.completedFlag(AnalysisType.ROI_PROJECTION, false));
    }

    @Test
    @DisplayName("Invalid analysis signals are rejected")
    void testInvalidAnalysis() {
        assertThrows(SignalValidationException.class, () -> collector.collectAnalysis(analysis("seo_audit", 1, true)));
        assertThrows(SignalValidationException.class, () -> collector.collectAnalysis(analysis("website", 0, true)));
        assertThrows(SignalValidationException.class, () -> collector.collectAnalysis(
                new AnalysisSignal(TENANT, PROSPECT, "website", 1, true, 101, NOW)));
        assertThrows(SignalValidationException.class, () -> collector.collectAnalysis(
                new AnalysisSignal(TENANT, PROSPECT, "website", 1, true, null, null)));
        verify(snapshotRepository, never()).save(any());
    }

    private static ActivitySignal activity(String externalId, String kind, String content) {
        return new ActivitySignal(TENANT, PROSPECT, INTEGRATION, externalId, kind, daysAgo(1), content);
    }

    private static AnalysisSignal analysis(String type, int version, Boolean completed) {
        return new AnalysisSignal(TENANT, PROSPECT, type, version, completed, 80, daysAgo(1));
    }
}
