package com.leadscoring.scoring;

/**
 * Terms of an engagement score. The bounce penalty is negative; the total is clamped.
 */
public record EngagementScoreBreakdown(
    EngagementTally tally,
    double openRatePoints,        // 0-15
    double clickRatePoints,       // 0-20
    double replyPoints,           // 0-25
    double bouncePenalty,         // <= 0
    double recencyPoints,         // 0-20
    double frequencyPoints,       // 0-20
    int total
) {
}
