package com.leadscoring.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadscoring.model.OutboxEvent;
import com.leadscoring.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes notifications into the outbox table.
 *
 * Joins the caller's transaction: the notification commits or rolls back together with the
 * rows it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public OutboxEvent enqueue(String topic, String aggregateId, Object event) {
        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setAggregateId(aggregateId);
        outboxEvent.setEventType(event.getClass().getSimpleName());
        outboxEvent.setTopic(topic);
        try {
            outboxEvent.setPayload(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + outboxEvent.getEventType() + " to outbox", e);
        }

        OutboxEvent saved = outboxEventRepository.save(outboxEvent);
        log.debug("Enqueued {} for {} to outbox (topic {})", saved.getEventType(), aggregateId, topic);
        return saved;
    }
}
