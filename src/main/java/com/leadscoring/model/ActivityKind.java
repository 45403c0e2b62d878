package com.leadscoring.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Outbound email activity kinds recorded in the engagement log.
 */
public enum ActivityKind {
    SENT,
    DELIVERED,
    OPENED,
    CLICKED,
    REPLIED,
    BOUNCED,
    UNSUBSCRIBED,
    COMPLAINED;

    /**
     * Activities that count as the prospect doing something (drives the recency term).
     */
    public boolean isInteraction() {
        return this == OPENED || this == CLICKED || this == REPLIED;
    }

    public static Optional<ActivityKind> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ActivityKind.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
