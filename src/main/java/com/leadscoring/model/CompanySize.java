package com.leadscoring.model;

import java.util.Locale;

/**
 * Company size category as reported by the prospect record.
 */
public enum CompanySize {
    STARTUP,
    SMALL,
    MEDIUM,
    LARGE,
    ENTERPRISE,
    UNKNOWN;

    /**
     * Lenient parse; anything unrecognised is UNKNOWN.
     */
    public static CompanySize fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return CompanySize.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
