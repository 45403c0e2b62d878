package com.leadscoring.model;

/**
 * Outreach status of a prospect, driven by engagement events.
 */
public enum LeadStatus {
    ACTIVE,
    REPLIED,
    UNSUBSCRIBED,
    BOUNCED,
    COMPLAINED
}
