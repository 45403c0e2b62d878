package com.leadscoring.classifier;

import com.leadscoring.model.Confidence;
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Keyword-based sentiment and intent classification of outbound-campaign replies.
 *
 * Total function: any input, including null, yields a classification. Upstream reply text is
 * unreliable (quoted threads, signatures, auto-replies), so ambiguity degrades to
 * neutral / general inquiry instead of failing.
 *
 * Rules:
 * <ul>
 *   <li>Sentiment: positive if any positive phrase matched, else negative if any negative
 *       phrase matched, else neutral.</li>
 *   <li>Intent, first match wins: meeting, pricing, unsubscribe, positive -> interested,
 *       negative -> not interested, otherwise general inquiry.</li>
 *   <li>Confidence is HIGH when a sentiment phrase matched, MEDIUM otherwise.</li>
 *   <li>Needs human review for positive / interested replies and meeting requests.</li>
 * </ul>
 */
@Component
@Slf4j
public class ReplyClassifier {

    enum Keyword {
        POSITIVE,
        NEGATIVE,
        MEETING,
        PRICING,
        UNSUBSCRIBE
    }

    private static final KeywordLexicon<Keyword> LEXICON = KeywordLexicon.builder(Keyword.class)
            .add(Keyword.POSITIVE, "interested", "yes", "sounds good", "tell me more", "schedule",
                    "call", "meeting", "demo", "pricing", "learn more")
            .add(Keyword.NEGATIVE, "not interested", "no", "remove", "unsubscribe", "stop", "spam",
                    "delete", "busy", "no thanks")
            .add(Keyword.MEETING, "meeting", "call", "demo", "schedule", "chat", "discuss")
            .add(Keyword.PRICING, "price", "cost", "pricing", "budget", "quote", "proposal")
            .add(Keyword.UNSUBSCRIBE, "remove", "unsubscribe")
            .build();

    public ReplyClassification classify(String content) {
        if (content == null || content.isBlank()) {
            return ReplyClassification.UNKNOWN;
        }

        Set<Keyword> hits = LEXICON.match(content);

        Sentiment sentiment;
        if (hits.contains(Keyword.POSITIVE)) {
            sentiment = Sentiment.POSITIVE;
        } else if (hits.contains(Keyword.NEGATIVE)) {
            sentiment = Sentiment.NEGATIVE;
        } else {
            sentiment = Sentiment.NEUTRAL;
        }

        ReplyIntent intent;
        if (hits.contains(Keyword.MEETING)) {
            intent = ReplyIntent.MEETING_REQUEST;
        } else if (hits.contains(Keyword.PRICING)) {
            intent = ReplyIntent.PRICING_INQUIRY;
        } else if (hits.contains(Keyword.UNSUBSCRIBE)) {
            intent = ReplyIntent.UNSUBSCRIBE_REQUEST;
        } else if (sentiment == Sentiment.POSITIVE) {
            intent = ReplyIntent.INTERESTED;
        } else if (sentiment == Sentiment.NEGATIVE) {
            intent = ReplyIntent.NOT_INTERESTED;
        } else {
            intent = ReplyIntent.GENERAL_INQUIRY;
        }

        Confidence confidence = hits.contains(Keyword.POSITIVE) || hits.contains(Keyword.NEGATIVE)
                ? Confidence.HIGH
                : Confidence.MEDIUM;

        boolean needsHumanReview = sentiment == Sentiment.POSITIVE
                || intent == ReplyIntent.INTERESTED
                || intent == ReplyIntent.MEETING_REQUEST;

        log.debug("Classified reply: sentiment={}, intent={}, confidence={}", sentiment, intent, confidence);
        return new ReplyClassification(sentiment, intent, confidence, needsHumanReview);
    }
}
