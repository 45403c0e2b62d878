package com.leadscoring.lifecycle;

import com.leadscoring.model.EngagementEvent;
import com.leadscoring.model.LeadStatus;
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;
import com.leadscoring.model.Temperature;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Derives temperature and lead status by replaying the engagement log in occurrence order.
 *
 * These fields are not monotonic: the latest event wins, so a negative reply after a positive
 * one cools the prospect down again. Sorting by (occurredAt, externalActivityId) before the
 * fold makes the result independent of arrival order.
 */
@Component
public class EngagementStateFolder {

    static final Comparator<EngagementEvent> OCCURRENCE_ORDER = Comparator
            .comparing(EngagementEvent::getOccurredAt)
            .thenComparing(EngagementEvent::getExternalActivityId);

    public EngagementState fold(Collection<EngagementEvent> log) {
        List<EngagementEvent> ordered = log.stream()
                .filter(e -> e.getKind() != null && e.getOccurredAt() != null)
                .sorted(OCCURRENCE_ORDER)
                .toList();

        EngagementState state = EngagementState.INITIAL;
        for (EngagementEvent event : ordered) {
            state = apply(state, event);
        }
        return state;
    }

    EngagementState apply(EngagementState state, EngagementEvent event) {
        return switch (event.getKind()) {
            case REPLIED -> applyReply(state, event.getReplySentiment(), event.getReplyIntent());
            case CLICKED -> state.temperature().isHotterThan(Temperature.WARM)
                    ? state
                    : state.withTemperature(Temperature.WARM);
            case UNSUBSCRIBED -> state.withStatus(LeadStatus.UNSUBSCRIBED);
            case COMPLAINED -> state.withStatus(LeadStatus.COMPLAINED);
            case BOUNCED -> state.withStatus(LeadStatus.BOUNCED);
            default -> state;
        };
    }

    private EngagementState applyReply(EngagementState state, Sentiment sentiment, ReplyIntent intent) {
        EngagementState next = state;
        if (sentiment == Sentiment.POSITIVE) {
            next = next.withTemperature(Temperature.HOT);
        } else if (sentiment == Sentiment.NEGATIVE) {
            next = next.withTemperature(Temperature.COLD);
        }

        if (sentiment == Sentiment.NEGATIVE || intent == ReplyIntent.UNSUBSCRIBE_REQUEST) {
            next = next.withStatus(LeadStatus.UNSUBSCRIBED);
        } else if (sentiment == Sentiment.POSITIVE || intent == ReplyIntent.INTERESTED) {
            next = next.withStatus(LeadStatus.REPLIED);
        }
        return next;
    }
}
