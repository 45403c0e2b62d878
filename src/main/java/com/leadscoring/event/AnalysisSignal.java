package com.leadscoring.event;

import java.time.Instant;

/**
 * Inbound notification that an analysis pass produced a new snapshot version.
 */
public record AnalysisSignal(
    String tenantId,
    String prospectId,
    String analysisType,
    Integer version,
    Boolean completed,            // null means "present", treated as completed except for website analysis
    Integer contentQualityScore,
    Instant analyzedAt
) {
}
