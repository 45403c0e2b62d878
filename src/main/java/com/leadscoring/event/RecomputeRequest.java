package com.leadscoring.event;

import java.util.Objects;

/**
 * Token emitted by the collector once something new was appended for a prospect.
 * Carries no data besides the scope: the recompute always folds the full log.
 */
public record RecomputeRequest(
    String tenantId,
    String prospectId,
    Trigger trigger
) {
    public RecomputeRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(prospectId, "prospectId");
        Objects.requireNonNull(trigger, "trigger");
    }

    public enum Trigger {
        ENGAGEMENT_EVENT,
        ANALYSIS_SNAPSHOT,
        OPPORTUNITIES_CHANGED,
        PROSPECT_REGISTERED,
        MANUAL
    }
}
