package com.leadscoring.collector;

import com.leadscoring.classifier.ReplyClassification;
import com.leadscoring.event.RecomputeRequest;

import java.util.Optional;

/**
 * Outcome of collecting one signal.
 *
 * @param recordId       id of the appended event / snapshot, null for duplicates
 * @param recompute      present only when something new was appended
 * @param classification reply classification, present only for appended replies
 */
public record CollectionResult(
    String recordId,
    boolean duplicate,
    Optional<RecomputeRequest> recompute,
    Optional<ReplyClassification> classification
) {

    public static CollectionResult appended(String recordId, RecomputeRequest recompute) {
        return new CollectionResult(recordId, false, Optional.of(recompute), Optional.empty());
    }

    public static CollectionResult appendedReply(String recordId, RecomputeRequest recompute,
                                                 ReplyClassification classification) {
        return new CollectionResult(recordId, false, Optional.of(recompute), Optional.of(classification));
    }

    public static CollectionResult duplicateSignal() {
        return new CollectionResult(null, true, Optional.empty(), Optional.empty());
    }

    public boolean isAppended() {
        return !duplicate;
    }
}
