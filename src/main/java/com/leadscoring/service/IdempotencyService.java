package com.leadscoring.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis-based delivery de-duplication for the Kafka consumers.
 *
 * KEY NAMING:
 * ===========
 * idempotency:{signalType}:{signalId}, e.g.
 * - idempotency:ActivitySignal:acme:p-42:msg-981
 * - idempotency:AnalysisSignal:acme:p-42:WEBSITE:3
 *
 * Keys expire after 7 days, matching Kafka's default retention.
 *
 * This is only a fast path. The collector's duplicate checks (external activity id, snapshot
 * version) and the unique constraints behind them are what actually keep the log clean, so
 * Redis errors fail open: the signal is processed and the collector drops it if it was seen.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private static final Duration IDEMPOTENCY_TTL = Duration.ofDays(7);
    private static final String IDEMPOTENCY_PREFIX = "idempotency:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    /**
     * Atomically claim a signal (SET NX EX).
     *
     * @return true if this is the first delivery (process it), false if it was already claimed
     */
    public boolean tryAcquire(String signalType, String signalId, String consumerName) {
        String key = buildKey(signalType, signalId);
        try {
            String value = consumerName + ":" + clock.millis();
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, value, IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Claimed {}:{} for {}", signalType, signalId, consumerName);
                return true;
            }
            log.info("Signal already processed: {}:{}", signalType, signalId);
            return false;

        } catch (Exception e) {
            log.error("Redis error claiming {}:{}, processing anyway", signalType, signalId, e);
            return true;
        }
    }

    /**
     * Drop a claim after a failed attempt so the redelivery is not mistaken for a duplicate.
     */
    public void release(String signalType, String signalId) {
        String key = buildKey(signalType, signalId);
        try {
            redisTemplate.delete(key);
            log.debug("Released {}:{}", signalType, signalId);
        } catch (Exception e) {
            log.error("Redis error releasing {}:{}, redelivery will be skipped until the key expires",
                      signalType, signalId, e);
        }
    }

    /**
     * Consumer name and epoch millis of the claim, or null. For debugging.
     */
    public String getProcessingInfo(String signalType, String signalId) {
        try {
            Object value = redisTemplate.opsForValue().get(buildKey(signalType, signalId));
            return value != null ? value.toString() : null;
        } catch (Exception e) {
            log.error("Redis error getting processing info: {}:{}", signalType, signalId, e);
            return null;
        }
    }

    private String buildKey(String signalType, String signalId) {
        return IDEMPOTENCY_PREFIX + signalType + ":" + signalId;
    }
}
