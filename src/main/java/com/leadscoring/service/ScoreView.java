package com.leadscoring.service;

import com.leadscoring.model.LeadStatus;
import com.leadscoring.model.ProspectStage;
import com.leadscoring.model.ScoreRecord;
import com.leadscoring.model.Temperature;

import java.time.Instant;

/**
 * Read model of a prospect's current scores, as served from the "scores" cache.
 */
public record ScoreView(
    String tenantId,
    String prospectId,
    ProspectStage stage,
    int leadScore,
    int engagementScore,
    Temperature temperature,
    LeadStatus leadStatus,
    Instant computedAt
) {
    public static ScoreView of(ScoreRecord record, ProspectStage stage) {
        return new ScoreView(record.getTenantId(), record.getProspectId(), stage,
                record.getLeadScore(), record.getEngagementScore(),
                record.getTemperature(), record.getLeadStatus(), record.getComputedAt());
    }
}
