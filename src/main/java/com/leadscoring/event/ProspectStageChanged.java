package com.leadscoring.event;

import com.leadscoring.model.ProspectStage;

import java.time.Instant;

/**
 * Stage transition notification (old -> new) for downstream automation,
 * e.g. report generation once a prospect reaches ANALYZED.
 */
public record ProspectStageChanged(
    String tenantId,
    String prospectId,
    ProspectStage previousStage,
    ProspectStage newStage,
    String cause,
    Instant timestamp
) {
    public ProspectStageChanged {
        if (previousStage == null || newStage == null) {
            throw new IllegalArgumentException("Both stages are required");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
