package com.leadscoring.classifier;

import com.leadscoring.model.Confidence;
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;

/**
 * Result of classifying one reply.
 */
public record ReplyClassification(
    Sentiment sentiment,
    ReplyIntent intent,
    Confidence confidence,
    boolean needsHumanReview
) {
    /**
     * What absent or unrecognisable content degrades to.
     */
    public static final ReplyClassification UNKNOWN =
            new ReplyClassification(Sentiment.NEUTRAL, ReplyIntent.GENERAL_INQUIRY, Confidence.MEDIUM, false);
}
