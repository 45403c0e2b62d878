package com.leadscoring.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadscoring.config.KafkaTopics;
import com.leadscoring.event.ActivitySignal;
import com.leadscoring.event.AnalysisSignal;
import com.leadscoring.event.SignalRejected;
import com.leadscoring.exception.SignalValidationException;
import com.leadscoring.producer.EventProducer;
import com.leadscoring.service.IdempotencyService;
import com.leadscoring.service.SignalIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Kafka entry point for inbound signals.
 *
 * PER DELIVERY:
 * =============
 * 1. Claim the signal in Redis; a claimed signal is a redelivery and is skipped
 * 2. Collect + recompute through SignalIngestionService
 * 3. Invalid signal: publish a SignalRejected record and commit the offset. The claim is released
 *    so the sender can resend it once fixed (e.g. after registering the prospect)
 * 4. Any other failure: release the claim and rethrow so the container redelivers
 *
 * Records are keyed by prospect id, so one prospect's signals are consumed in order on one
 * thread; the row lock in the recompute covers REST calls racing with the consumer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProspectSignalConsumer {

    private static final String CONSUMER_NAME = "ProspectSignalConsumer";

    private final IdempotencyService idempotencyService;
    private final SignalIngestionService ingestionService;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @KafkaListener(topics = KafkaTopics.ACTIVITY_RECEIVED, containerFactory = "kafkaListenerContainerFactory")
    public void onActivity(ActivitySignal signal) {
        String signalId = signal.tenantId() + ":" + signal.prospectId() + ":" + signal.externalActivityId();
        if (!idempotencyService.tryAcquire("ActivitySignal", signalId, CONSUMER_NAME)) {
            return;
        }

        try {
            ingestionService.ingestActivity(signal);
        } catch (SignalValidationException e) {
            idempotencyService.release("ActivitySignal", signalId);
            reject(signal.tenantId(), e, signal);
        } catch (RuntimeException e) {
            idempotencyService.release("ActivitySignal", signalId);
            log.error("Failed to process activity {} for prospect {}", signal.externalActivityId(), signal.prospectId(), e);
            throw e;
        }
    }

    @KafkaListener(topics = KafkaTopics.ANALYSIS_COMPLETED, containerFactory = "kafkaListenerContainerFactory")
    public void onAnalysis(AnalysisSignal signal) {
        String signalId = signal.tenantId() + ":" + signal.prospectId() + ":"
                + signal.analysisType() + ":" + signal.version();
        if (!idempotencyService.tryAcquire("AnalysisSignal", signalId, CONSUMER_NAME)) {
            return;
        }

        try {
            ingestionService.ingestAnalysis(signal);
        } catch (SignalValidationException e) {
            idempotencyService.release("AnalysisSignal", signalId);
            reject(signal.tenantId(), e, signal);
        } catch (RuntimeException e) {
            idempotencyService.release("AnalysisSignal", signalId);
            log.error("Failed to process {} analysis v{} for prospect {}",
                      signal.analysisType(), signal.version(), signal.prospectId(), e);
            throw e;
        }
    }

    private void reject(String tenantId, SignalValidationException e, Object signal) {
        eventProducer.publishRejection(new SignalRejected(
                tenantId, e.getSubjectId(), e.getComponent(), e.getMessage(), toJson(signal), Instant.now(clock)));
    }

    private String toJson(Object signal) {
        try {
            return objectMapper.writeValueAsString(signal);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize rejected signal, sending its string form", e);
            return String.valueOf(signal);
        }
    }
}
