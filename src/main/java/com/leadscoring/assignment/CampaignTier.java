package com.leadscoring.assignment;

import com.leadscoring.model.AssignmentPriority;

import java.math.BigDecimal;

/**
 * Rows of the assignment decision table, highest tier first.
 */
enum CampaignTier {
    ENTERPRISE("enterprise_vip", "seq_enterprise_executive", new BigDecimal("0.5"), AssignmentPriority.HIGH),
    PROFESSIONAL("professional_priority", "seq_professional_priority", new BigDecimal("1"), AssignmentPriority.MEDIUM),
    WARM("warm_prospects", "seq_warm_nurture", new BigDecimal("4"), AssignmentPriority.MEDIUM),
    COLD("cold_outreach", "seq_cold_education", new BigDecimal("24"), AssignmentPriority.LOW);

    final String campaign;
    final String sequence;
    final BigDecimal delayHours;
    final AssignmentPriority priority;

    CampaignTier(String campaign, String sequence, BigDecimal delayHours, AssignmentPriority priority) {
        this.campaign = campaign;
        this.sequence = sequence;
        this.delayHours = delayHours;
        this.priority = priority;
    }
}
