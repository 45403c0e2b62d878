package com.leadscoring.event;

import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;

import java.time.Instant;

/**
 * A reply that a human should look at (positive, interested, or asking for a meeting).
 */
public record ReplyReviewRequested(
    String tenantId,
    String prospectId,
    String externalActivityId,
    Sentiment sentiment,
    ReplyIntent intent,
    Instant timestamp
) {
}
