package com.leadscoring.event;

import com.leadscoring.model.LeadStatus;
import com.leadscoring.model.Temperature;

import java.time.Instant;

/**
 * Published whenever a recompute changed the stored ScoreRecord.
 */
public record ProspectRescored(
    String tenantId,
    String prospectId,
    int leadScore,
    int engagementScore,
    Temperature temperature,
    LeadStatus leadStatus,
    Instant timestamp
) {
}
