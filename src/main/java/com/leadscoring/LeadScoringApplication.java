package com.leadscoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lead scoring and campaign assignment engine.
 *
 * Flow:
 * Webhook relay / REST -> SignalCollector (append to log) -> ProspectRecomputeService
 * (scores, stage, assignment, outbox) -> OutboxEventPublisher -> Kafka
 *
 * Scheduling drives the outbox publisher.
 */
@SpringBootApplication
@EnableScheduling
public class LeadScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadScoringApplication.class, args);
    }
}
