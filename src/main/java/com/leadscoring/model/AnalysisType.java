package com.leadscoring.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of external analysis passes that feed the completeness component of the lead score.
 */
public enum AnalysisType {
    WEBSITE,
    CUSTOMER_JOURNEY,
    AUTOMATION_OPPORTUNITY,
    ROI_PROJECTION;

    public static Optional<AnalysisType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(AnalysisType.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
