package com.leadscoring.lifecycle;

import com.leadscoring.model.ActivityKind;
import com.leadscoring.model.EngagementEvent;
import com.leadscoring.model.LeadStatus;
import com.leadscoring.model.ReplyIntent;
import com.leadscoring.model.Sentiment;
import com.leadscoring.model.Temperature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.leadscoring.Fixtures.daysAgo;
import static com.leadscoring.Fixtures.event;
import static com.leadscoring.Fixtures.reply;
import static org.junit.jupiter.api.Assertions.*;

class EngagementStateFolderTest {

    private EngagementStateFolder folder;

    @BeforeEach
    void setUp() {
        folder = new EngagementStateFolder();
    }

    @Test
    @DisplayName("Empty log is cold and active")
    void testInitial() {
        assertEquals(EngagementState.INITIAL, folder.fold(Collections.emptyList()));
    }

    @Test
    @DisplayName("Positive reply makes the prospect hot and replied")
    void testPositiveReply() {
        EngagementState state = folder.fold(List.of(
                event(ActivityKind.SENT, daysAgo(3)),
                reply(daysAgo(1), Sentiment.POSITIVE, ReplyIntent.MEETING_REQUEST)));

        assertEquals(new EngagementState(Temperature.HOT, LeadStatus.REPLIED), state);
    }

    @Test
    @DisplayName("Negative reply makes the prospect cold and unsubscribed")
    void testNegativeReply() {
        EngagementState state = folder.fold(List.of(
                event(ActivityKind.CLICKED, daysAgo(3)),
                reply(daysAgo(1), Sentiment.NEGATIVE, ReplyIntent.NOT_INTERESTED)));

        assertEquals(new EngagementState(Temperature.COLD, LeadStatus.UNSUBSCRIBED), state);
    }

    @Test
    @DisplayName("Neutral unsubscribe request only changes the status")
    void testUnsubscribeIntent() {
        EngagementState state = folder.fold(List.of(
                event(ActivityKind.CLICKED, daysAgo(3)),
                reply(daysAgo(1), Sentiment.NEUTRAL, ReplyIntent.UNSUBSCRIBE_REQUEST)));

        assertEquals(new EngagementState(Temperature.WARM, LeadStatus.UNSUBSCRIBED), state);
    }

    @Test
    @DisplayName("A click does not cool a hot prospect")
    void testClickKeepsHotter() {
        EngagementState state = folder.fold(List.of(
                reply(daysAgo(3), Sentiment.POSITIVE, ReplyIntent.INTERESTED),
                event(ActivityKind.CLICKED, daysAgo(1))));

        assertEquals(Temperature.HOT, state.temperature());
    }

    @Test
    @DisplayName("The most recent signal wins: click after a negative reply warms up again")
    void testLatestWins() {
        EngagementState state = folder.fold(List.of(
                reply(daysAgo(3), Sentiment.NEGATIVE, ReplyIntent.NOT_INTERESTED),
                event(ActivityKind.CLICKED, daysAgo(1))));

        assertEquals(Temperature.WARM, state.temperature());
        assertEquals(LeadStatus.UNSUBSCRIBED, state.leadStatus());
    }

    @Test
    @DisplayName("Occurrence time decides, not arrival order")
    void testArrivalOrderIrrelevant() {
        List<EngagementEvent> events = new ArrayList<>(List.of(
                reply(daysAgo(1), Sentiment.NEGATIVE, ReplyIntent.NOT_INTERESTED),
                reply(daysAgo(5), Sentiment.POSITIVE, ReplyIntent.INTERESTED),
                event(ActivityKind.CLICKED, daysAgo(3))));

        EngagementState forward = folder.fold(events);
        Collections.reverse(events);
        EngagementState reversed = folder.fold(events);

        assertEquals(new EngagementState(Temperature.COLD, LeadStatus.UNSUBSCRIBED), forward);
        assertEquals(forward, reversed);
    }

    @Test
    @DisplayName("Bounce, complaint and unsubscribe events set the status")
    void testDeliveryStatuses() {
        assertEquals(LeadStatus.BOUNCED,
                folder.fold(List.of(event(ActivityKind.BOUNCED, daysAgo(1)))).leadStatus());
        assertEquals(LeadStatus.COMPLAINED,
                folder.fold(List.of(event(ActivityKind.COMPLAINED, daysAgo(1)))).leadStatus());
        assertEquals(LeadStatus.UNSUBSCRIBED,
                folder.fold(List.of(event(ActivityKind.UNSUBSCRIBED, daysAgo(1)))).leadStatus());
    }
}
