package com.leadscoring.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadscoring.event.CampaignAssigned;
import com.leadscoring.event.ProspectRescored;
import com.leadscoring.event.ProspectStageChanged;
import com.leadscoring.event.ReplyReviewRequested;
import com.leadscoring.model.OutboxEvent;
import com.leadscoring.producer.EventProducer;
import com.leadscoring.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Ships outbox rows written by recomputes to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Every 100ms, fetch the oldest unpublished rows (at most BATCH_SIZE)
 * 2. Deserialize each payload into its notification record
 * 3. Send it to the row's topic, keyed by prospect id
 * 4. Mark the row published; on failure bump retryCount and keep it for the next poll
 *
 * Delivery is at-least-once. A crash between send and commit re-sends the row; consumers of
 * the notifications treat them as upserts keyed by prospect.
 *
 * MONITORING:
 * -----------
 * - Rows failing MAX_RETRY_COUNT times are logged as errors
 * - Rows unpublished for more than 5 minutes are logged every minute
 * - Queue size above 1000 is logged as a warning
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRY_COUNT = 10;
    private static final Duration STUCK_THRESHOLD = Duration.ofMinutes(5);
    private static final long QUEUE_SIZE_WARNING = 1000;

    private static final Map<String, Class<?>> PAYLOAD_TYPES = Map.of(
            ProspectRescored.class.getSimpleName(), ProspectRescored.class,
            CampaignAssigned.class.getSimpleName(), CampaignAssigned.class,
            ProspectStageChanged.class.getSimpleName(), ProspectStageChanged.class,
            ReplyReviewRequested.class.getSimpleName(), ReplyReviewRequested.class);

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${leadscoring.outbox.poll-interval-ms:100}")
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEventsWithLimit(BATCH_SIZE);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    void publishEvent(OutboxEvent outboxEvent) throws Exception {
        Object payload = deserializeEvent(outboxEvent);

        // Wait for the ack so a failed send is retried instead of being marked published
        eventProducer.publish(outboxEvent.getTopic(), outboxEvent.getAggregateId(), payload).get();

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now(clock));
        outboxEventRepository.save(outboxEvent);

        log.debug("Published outbox event {} ({})", outboxEvent.getId(), outboxEvent.getEventType());
    }

    Object deserializeEvent(OutboxEvent outboxEvent) throws Exception {
        Class<?> type = PAYLOAD_TYPES.get(outboxEvent.getEventType());
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        }
        return objectMapper.readValue(outboxEvent.getPayload(), type);
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Outbox event {} ({}) has failed {} times. Manual intervention may be required. Error: {}",
                      event.getId(), event.getEventType(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish outbox event {} (attempt {}): {}",
                     event.getId(), event.getRetryCount(), e.getMessage());
        }
    }

    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now(clock).minus(STUCK_THRESHOLD);
            List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} outbox events older than {} minutes", stuckEvents.size(), STUCK_THRESHOLD.toMinutes());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, type={}, prospect={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventType(), event.getAggregateId(),
                              event.getCreatedAt(), event.getRetryCount(), event.getLastError()));
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > QUEUE_SIZE_WARNING) {
                log.warn("Outbox queue size is {}, publisher is falling behind", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }
        } catch (Exception e) {
            log.error("Error monitoring stuck outbox events", e);
        }
    }
}
