package com.leadscoring.producer;

import com.leadscoring.config.KafkaTopics;
import com.leadscoring.event.SignalRejected;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes engine notifications to Kafka.
 *
 * Sends are asynchronous: the returned future completes once the broker acknowledged. Records
 * are keyed by prospect id so that notifications of one prospect keep their order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * Publish any notification record to the given topic.
     *
     * @param topic target topic, one of {@link KafkaTopics}
     * @param key   record key (prospect id)
     * @param event payload record
     */
    public CompletableFuture<SendResult<String, Object>> publish(String topic, String key, Object event) {
        String eventType = event.getClass().getSimpleName();
        log.debug("Publishing {} for {} to {}", eventType, key, topic);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} for {} to {}", eventType, key, topic, ex);
            } else {
                log.info("Published {} for {} to {} (partition {})",
                        eventType, key, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }

    /**
     * Rejected inbound signals bypass the outbox: nothing was written for them, so there is no
     * transaction to tie the notification to.
     */
    public CompletableFuture<SendResult<String, Object>> publishRejection(SignalRejected rejection) {
        String key = rejection.prospectId() != null ? rejection.prospectId() : rejection.tenantId();
        log.warn("Rejecting signal for prospect {} in {}: {}",
                rejection.prospectId(), rejection.component(), rejection.reason());
        return publish(KafkaTopics.SIGNAL_REJECTED, key, rejection);
    }
}
