package com.leadscoring.service;

import com.leadscoring.model.AssignmentPriority;
import com.leadscoring.model.CampaignAssignment;

import java.math.BigDecimal;
import java.time.Instant;

public record AssignmentView(
    String assignmentId,
    String campaignId,
    String sequenceId,
    BigDecimal delayHours,
    AssignmentPriority priority,
    String reason,
    int leadScore,
    BigDecimal roiPotential,
    int opportunityCount,
    Instant assignedAt
) {
    public static AssignmentView of(CampaignAssignment assignment) {
        return new AssignmentView(assignment.getAssignmentId(), assignment.getCampaignId(),
                assignment.getSequenceId(), assignment.getDelayHours(), assignment.getPriority(),
                assignment.getReason(), assignment.getLeadScore(), assignment.getRoiPotential(),
                assignment.getOpportunityCount(), assignment.getAssignedAt());
    }
}
