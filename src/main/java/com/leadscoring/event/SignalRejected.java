package com.leadscoring.event;

import java.time.Instant;

/**
 * Dead-letter record for an inbound signal that failed validation.
 * Rejections are reported, never dropped silently.
 */
public record SignalRejected(
    String tenantId,
    String prospectId,
    String component,
    String reason,
    String originalPayload,
    Instant timestamp
) {
}
