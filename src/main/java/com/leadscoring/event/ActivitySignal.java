package com.leadscoring.event;

import java.time.Instant;

/**
 * Inbound email activity, as handed over by the webhook / import layer.
 *
 * Deliberately unvalidated: the record is what arrived on the wire, and SignalCollector decides
 * whether it is acceptable. Kind is a free string ("opened", "REPLIED", ...).
 */
public record ActivitySignal(
    String tenantId,
    String prospectId,
    String integrationId,        // channel identity (mailbox / outreach integration)
    String externalActivityId,   // id assigned by the sending platform, used for dedup
    String kind,
    Instant occurredAt,
    String replyContent          // only for replies
) {
}
