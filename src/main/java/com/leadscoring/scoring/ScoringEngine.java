package com.leadscoring.scoring;

import com.leadscoring.exception.IntegrationNotFoundException;
import com.leadscoring.exception.ProspectNotFoundException;
import com.leadscoring.model.EngagementEvent;
import com.leadscoring.model.Prospect;
import com.leadscoring.repository.AnalysisSnapshotRepository;
import com.leadscoring.repository.EngagementEventRepository;
import com.leadscoring.repository.OpportunityRecordRepository;
import com.leadscoring.repository.ProspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of scoring: loads the inputs of one tenant + prospect (or integration) and hands
 * them to the pure calculators. Nothing here writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoringEngine {

    private static final String COMPONENT = "ScoringEngine";

    private final ProspectRepository prospectRepository;
    private final OpportunityRecordRepository opportunityRepository;
    private final AnalysisSnapshotRepository snapshotRepository;
    private final EngagementEventRepository engagementEventRepository;
    private final LeadScoreCalculator leadScoreCalculator;
    private final EngagementScoreCalculator engagementScoreCalculator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public LeadScoreBreakdown leadScore(String tenantId, String prospectId) {
        Prospect prospect = prospectRepository.findByTenantIdAndProspectId(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));
        return leadScore(prospect);
    }

    /**
     * Lead score of an already loaded prospect (used inside the recompute transaction).
     */
    public LeadScoreBreakdown leadScore(Prospect prospect) {
        LeadScoreBreakdown breakdown = leadScoreCalculator.calculate(
                prospect.getCompanySize(),
                opportunityRepository.findByTenantIdAndProspectId(prospect.getTenantId(), prospect.getProspectId()),
                snapshotRepository.findByTenantIdAndProspectId(prospect.getTenantId(), prospect.getProspectId()));
        log.debug("Lead score for prospect {}: {}", prospect.getProspectId(), breakdown);
        return breakdown;
    }

    /**
     * Engagement score of a single integration (channel identity).
     *
     * @throws IntegrationNotFoundException if the tenant has no events for the integration
     */
    @Transactional(readOnly = true)
    public EngagementScoreBreakdown engagementScore(String tenantId, String integrationId) {
        List<EngagementEvent> events = engagementEventRepository.findByTenantIdAndIntegrationId(tenantId, integrationId);
        if (events.isEmpty()) {
            throw new IntegrationNotFoundException(COMPONENT, tenantId, integrationId);
        }
        return engagementScoreCalculator.calculate(events, Instant.now(clock));
    }

    /**
     * Prospect-level engagement: best score over the prospect's integrations, 0 when it has no log.
     */
    public int prospectEngagementScore(Collection<EngagementEvent> prospectLog, Instant now) {
        Map<String, List<EngagementEvent>> byIntegration = prospectLog.stream()
                .collect(Collectors.groupingBy(EngagementEvent::getIntegrationId));
        return byIntegration.values().stream()
                .mapToInt(events -> engagementScoreCalculator.calculate(events, now).total())
                .max()
                .orElse(0);
    }
}
