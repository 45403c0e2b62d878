package com.leadscoring.model;

/**
 * Intent of a reply. Resolution order is meeting, pricing, unsubscribe, then sentiment fallbacks.
 */
public enum ReplyIntent {
    MEETING_REQUEST,
    PRICING_INQUIRY,
    UNSUBSCRIBE_REQUEST,
    INTERESTED,
    NOT_INTERESTED,
    GENERAL_INQUIRY
}
