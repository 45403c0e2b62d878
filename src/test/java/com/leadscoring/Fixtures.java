package com.leadscoring;

import com.leadscoring.model.ActivityKind;
import com.leadscoring.model.AnalysisSnapshot;
import com.leadscoring.model.AnalysisType;
import com.leadscoring.model.CompanySize;
import com.leadscoring.model.EngagementEvent;
import com.leadscoring.model.OpportunityRecord;
import com.leadscoring.model.Prospect;
import com.leadscoring.model.ProspectStage;
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;
import com.leadscoring.model.ServiceTier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Builders for the entities the tests feed into calculators and services.
 */
public final class Fixtures {

    public static final String TENANT = "acme";
    public static final String PROSPECT = "p-42";
    public static final String INTEGRATION = "mailbox-1";
    public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {
    }

    public static Prospect prospect(CompanySize size, String industry, ProspectStage stage) {
        Prospect prospect = new Prospect();
        prospect.setTenantId(TENANT);
        prospect.setProspectId(PROSPECT);
        prospect.setName("Acme Prospect");
        prospect.setCompanySize(size);
        prospect.setIndustry(industry);
        prospect.setStage(stage);
        prospect.setCreatedAt(NOW.minusSeconds(86_400));
        return prospect;
    }

    public static OpportunityRecord opportunity(int priorityScore, ServiceTier tier, String roi) {
        OpportunityRecord record = new OpportunityRecord();
        record.setOpportunityId(UUID.randomUUID().toString());
        record.setTenantId(TENANT);
        record.setProspectId(PROSPECT);
        record.setProcessName("Invoice processing");
        record.setPriorityScore(priorityScore);
        record.setServiceTier(tier);
        record.setRoiEstimate(roi == null ? null : new BigDecimal(roi));
        record.setCreatedAt(NOW);
        return record;
    }

    public static AnalysisSnapshot snapshot(AnalysisType type, int version, boolean completed) {
        AnalysisSnapshot snapshot = new AnalysisSnapshot();
        snapshot.setSnapshotId(UUID.randomUUID().toString());
        snapshot.setTenantId(TENANT);
        snapshot.setProspectId(PROSPECT);
        snapshot.setAnalysisType(type);
        snapshot.setVersion(version);
        snapshot.setCompleted(completed);
        snapshot.setAnalyzedAt(NOW);
        snapshot.setRecordedAt(NOW);
        return snapshot;
    }

    public static EngagementEvent event(ActivityKind kind, Instant occurredAt) {
        return event(kind, occurredAt, INTEGRATION);
    }

    public static EngagementEvent event(ActivityKind kind, Instant occurredAt, String integrationId) {
        EngagementEvent event = new EngagementEvent();
        event.setEventId(UUID.randomUUID().toString());
        event.setTenantId(TENANT);
        event.setProspectId(PROSPECT);
        event.setIntegrationId(integrationId);
        event.setExternalActivityId("ext-" + UUID.randomUUID());
        event.setKind(kind);
        event.setOccurredAt(occurredAt);
        event.setReceivedAt(occurredAt);
        return event;
    }

    public static EngagementEvent reply(Instant occurredAt, Sentiment sentiment, ReplyIntent intent) {
        EngagementEvent event = event(ActivityKind.REPLIED, occurredAt);
        event.setReplySentiment(sentiment);
        event.setReplyIntent(intent);
        event.setNeedsHumanReview(false);
        return event;
    }

    public static Instant daysAgo(double days) {
        return NOW.minusSeconds((long) (days * 86_400));
    }
}
