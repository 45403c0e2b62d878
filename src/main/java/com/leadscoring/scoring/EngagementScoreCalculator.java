package com.leadscoring.scoring;

import com.leadscoring.model.EngagementEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Engagement score folded from an engagement log.
 *
 * <pre>
 * only when at least one message was sent:
 *   open rate    0-15   min(15, opened / sent * 100 * 0.6)
 *   click rate   0-20   min(20, clicked / opened * 100 * 6.67), needs opened > 0
 *   replies      0-25   min(25, replies * 25)
 *   bounces      -5 each
 * always:
 *   recency      0-20   days since last open/click/reply: <=1 20, <=7 15, <=30 10, <=90 5
 *   frequency    0-20   min(20, distinct active days in the trailing 30 days * 2)
 * </pre>
 *
 * The fold only counts and takes maxima, so the result does not depend on the order the events
 * arrived in. Callers pass "now" explicitly.
 */
@Component
public class EngagementScoreCalculator {

    static final int TRAILING_WINDOW_DAYS = 30;
    private static final double SECONDS_PER_DAY = 86_400.0;

    public EngagementScoreBreakdown calculate(Collection<EngagementEvent> events, Instant now) {
        EngagementTally tally = tally(events, now);

        double openPoints = 0.0;
        double clickPoints = 0.0;
        double replyPoints = 0.0;
        double bouncePenalty = 0.0;

        if (tally.sent() > 0) {
            openPoints = Math.min(15.0, ScoreMath.ratio(tally.opened(), tally.sent()) * 100 * 0.6);
            if (tally.opened() > 0) {
                clickPoints = Math.min(20.0, ScoreMath.ratio(tally.clicked(), tally.opened()) * 100 * 6.67);
            }
            replyPoints = Math.min(25.0, tally.replied() * 25.0);
            bouncePenalty = -5.0 * tally.bounced();
        }

        double recencyPoints = recencyPoints(tally.lastInteractionAt(), now);
        double frequencyPoints = Math.min(20.0, tally.activeDaysLast30() * 2.0);

        int total = ScoreMath.clampScore(
                openPoints + clickPoints + replyPoints + bouncePenalty + recencyPoints + frequencyPoints);

        return new EngagementScoreBreakdown(
                tally, openPoints, clickPoints, replyPoints, bouncePenalty, recencyPoints, frequencyPoints, total);
    }

    EngagementTally tally(Collection<EngagementEvent> events, Instant now) {
        long sent = 0;
        long opened = 0;
        long clicked = 0;
        long replied = 0;
        long bounced = 0;
        Instant lastInteraction = null;
        Set<LocalDate> activeDays = new HashSet<>();
        Instant windowStart = now.minus(Duration.ofDays(TRAILING_WINDOW_DAYS));

        if (events != null) {
            for (EngagementEvent event : events) {
                if (event.getKind() == null || event.getOccurredAt() == null) {
                    continue;
                }
                switch (event.getKind()) {
                    case SENT -> sent++;
                    case OPENED -> opened++;
                    case CLICKED -> clicked++;
                    case REPLIED -> replied++;
                    case BOUNCED -> bounced++;
                    default -> {
                        // delivered / unsubscribed / complained only count towards activity days
                    }
                }
                if (event.getKind().isInteraction()
                        && (lastInteraction == null || event.getOccurredAt().isAfter(lastInteraction))) {
                    lastInteraction = event.getOccurredAt();
                }
                if (event.getOccurredAt().isAfter(windowStart)) {
                    activeDays.add(LocalDate.ofInstant(event.getOccurredAt(), ZoneOffset.UTC));
                }
            }
        }

        return new EngagementTally(sent, opened, clicked, replied, bounced, lastInteraction, activeDays.size());
    }

    double recencyPoints(Instant lastInteraction, Instant now) {
        if (lastInteraction == null) {
            return 0.0;
        }
        double days = Duration.between(lastInteraction, now).getSeconds() / SECONDS_PER_DAY;
        if (days <= 1) {
            return 20.0;
        } else if (days <= 7) {
            return 15.0;
        } else if (days <= 30) {
            return 10.0;
        } else if (days <= 90) {
            return 5.0;
        }
        return 0.0;
    }
}
