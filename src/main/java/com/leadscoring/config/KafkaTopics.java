package com.leadscoring.config;

/**
 * Kafka topic names, inbound first.
 */
public class KafkaTopics {

    // Email activity forwarded by the webhook layer
    public static final String ACTIVITY_RECEIVED = "prospect.activity.received";

    // New analysis snapshot versions
    public static final String ANALYSIS_COMPLETED = "prospect.analysis.completed";

    // Signals that failed validation, with the reason
    public static final String SIGNAL_REJECTED = "prospect.signal.rejected";

    // Outbound, written through the outbox
    public static final String SCORE_UPDATED = "prospect.score.updated";
    public static final String CAMPAIGN_ASSIGNED = "prospect.campaign.assigned";
    public static final String STAGE_CHANGED = "prospect.stage.changed";
    public static final String REPLY_REVIEW = "prospect.reply.review";

    private KafkaTopics() {
    }
}
