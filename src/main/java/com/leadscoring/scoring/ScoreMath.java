package com.leadscoring.scoring;

/**
 * Small numeric helpers shared by the calculators.
 */
final class ScoreMath {

    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    private ScoreMath() {
    }

    /**
     * numerator / denominator, or 0 when the denominator is 0.
     */
    static double ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return (double) numerator / denominator;
    }

    /**
     * Clamp to [0, 100] and round half up.
     */
    static int clampScore(double raw) {
        if (Double.isNaN(raw)) {
            return MIN_SCORE;
        }
        double clamped = Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
        return (int) Math.round(clamped);
    }
}
