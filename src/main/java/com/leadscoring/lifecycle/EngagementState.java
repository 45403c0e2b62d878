package com.leadscoring.lifecycle;

import com.leadscoring.model.LeadStatus;
import com.leadscoring.model.Temperature;

/**
 * Temperature and lead status at some point of the engagement log.
 */
public record EngagementState(Temperature temperature, LeadStatus leadStatus) {

    public static final EngagementState INITIAL = new EngagementState(Temperature.COLD, LeadStatus.ACTIVE);

    EngagementState withTemperature(Temperature temperature) {
        return new EngagementState(temperature, leadStatus);
    }

    EngagementState withStatus(LeadStatus leadStatus) {
        return new EngagementState(temperature, leadStatus);
    }
}
