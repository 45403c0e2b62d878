package com.leadscoring.event;

import com.leadscoring.model.AssignmentPriority;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a prospect gets a new outreach treatment; consumed by sequence enrollment.
 */
public record CampaignAssigned(
    String assignmentId,
    String tenantId,
    String prospectId,
    String campaignId,
    String sequenceId,
    BigDecimal delayHours,
    AssignmentPriority priority,
    String reason,
    Instant timestamp
) {
}
