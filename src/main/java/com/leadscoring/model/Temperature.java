package com.leadscoring.model;

/**
 * Coarse engagement category. Declaration order is coldest to hottest.
 */
public enum Temperature {
    COLD,
    WARM,
    HOT,
    INTERESTED,
    QUALIFIED;

    public boolean isHotterThan(Temperature other) {
        return this.ordinal() > other.ordinal();
    }
}
