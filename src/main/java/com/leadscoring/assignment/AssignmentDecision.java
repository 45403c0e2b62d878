package com.leadscoring.assignment;

import com.leadscoring.model.AssignmentPriority;
import com.leadscoring.model.CampaignAssignment;

import java.math.BigDecimal;

/**
 * Outreach treatment chosen by {@link CampaignAssignmentResolver}.
 */
public record AssignmentDecision(
    String campaignId,
    String sequenceId,
    BigDecimal delayHours,
    AssignmentPriority priority,
    String reason
) {
    /**
     * Same campaign, sequence, delay and priority. The reason is ignored: it changes with every
     * score tweak and on its own is no reason to re-enroll a prospect.
     */
    public boolean sameTreatmentAs(CampaignAssignment current) {
        return current != null
                && campaignId.equals(current.getCampaignId())
                && sequenceId.equals(current.getSequenceId())
                && delayHours.compareTo(current.getDelayHours()) == 0
                && priority == current.getPriority();
    }
}
