package com.leadscoring.service;

import com.leadscoring.collector.CollectionResult;
import com.leadscoring.collector.SignalCollector;
import com.leadscoring.event.ActivitySignal;
import com.leadscoring.event.AnalysisSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Collect, then recompute.
 *
 * Collection and recompute are two transactions. Once the collector committed, the signal is
 * in the log for good; if the recompute then fails, the exception propagates and the caller
 * retries, and the retry recomputes from the log (the signal itself comes back as a duplicate).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalIngestionService {

    private final SignalCollector signalCollector;
    private final ProspectRecomputeService recomputeService;

    public record IngestionResult(CollectionResult collection, Optional<RecomputeOutcome> recompute) {
    }

    public IngestionResult ingestActivity(ActivitySignal signal) {
        return recompute(collect(() -> signalCollector.collectActivity(signal)));
    }

    public IngestionResult ingestAnalysis(AnalysisSignal signal) {
        return recompute(collect(() -> signalCollector.collectAnalysis(signal)));
    }

    private CollectionResult collect(Supplier<CollectionResult> collector) {
        try {
            return collector.get();
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent delivery of the same signal
            log.info("Concurrent duplicate signal rejected by constraint: {}", e.getMostSpecificCause().getMessage());
            return CollectionResult.duplicateSignal();
        }
    }

    private IngestionResult recompute(CollectionResult collected) {
        Optional<RecomputeOutcome> outcome = collected.recompute().map(recomputeService::recompute);
        return new IngestionResult(collected, outcome);
    }
}
