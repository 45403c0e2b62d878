package com.leadscoring.scoring;

import java.time.Instant;

/**
 * Counters folded from an engagement log.
 *
 * @param lastInteractionAt latest opened / clicked / replied timestamp, null if none
 * @param activeDaysLast30 distinct UTC days with any activity in the trailing 30 days
 */
public record EngagementTally(
    long sent,
    long opened,
    long clicked,
    long replied,
    long bounced,
    Instant lastInteractionAt,
    int activeDaysLast30
) {
}
