package com.leadscoring.service;

import com.leadscoring.assignment.AssignmentDecision;
import com.leadscoring.assignment.AssignmentInputs;
import com.leadscoring.assignment.CampaignAssignmentResolver;
import com.leadscoring.config.KafkaTopics;
import com.leadscoring.event.CampaignAssigned;
import com.leadscoring.event.ProspectRescored;
import com.leadscoring.event.ProspectStageChanged;
import com.leadscoring.event.RecomputeRequest;
import com.leadscoring.exception.ProspectNotFoundException;
import com.leadscoring.lifecycle.EngagementState;
import com.leadscoring.lifecycle.EngagementStateFolder;
import com.leadscoring.lifecycle.ProspectLifecycle;
import com.leadscoring.lifecycle.StageTransition;
import com.leadscoring.model.AnalysisSnapshot;
import com.leadscoring.model.CampaignAssignment;
import com.leadscoring.model.EngagementEvent;
import com.leadscoring.model.OpportunityRecord;
import com.leadscoring.model.Prospect;
import com.leadscoring.model.ScoreRecord;
import com.leadscoring.repository.AnalysisSnapshotRepository;
import com.leadscoring.repository.CampaignAssignmentRepository;
import com.leadscoring.repository.EngagementEventRepository;
import com.leadscoring.repository.OpportunityRecordRepository;
import com.leadscoring.repository.ProspectRepository;
import com.leadscoring.repository.ScoreRecordRepository;
import com.leadscoring.scoring.LeadScoreBreakdown;
import com.leadscoring.scoring.LeadScoreCalculator;
import com.leadscoring.scoring.ScoringEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PROSPECT RECOMPUTE
 * ==================
 *
 * Recomputes everything derived for one prospect: scores, temperature, lead status, stage
 * and campaign assignment.
 *
 * FLOW (one transaction):
 * -----------------------
 * 1. Lock the prospect row (SELECT ... FOR UPDATE). Recomputes of one prospect run one at a time;
 *    different prospects run in parallel.
 * 2. Load opportunities, snapshots and the full engagement log.
 * 3. Scores: lead score from firmographics + opportunities + snapshots; engagement score,
 *    temperature and status by folding the whole log.
 * 4. Stage: catch up with the snapshots recorded so far (identified..analyzed only).
 * 5. Assignment: resolve; append a new row only when the treatment differs from the current one.
 * 6. Write a notification to the outbox for each change, evict the cached reads.
 *
 * Every input is re-read and every output is a function of it, so running the same request
 * twice (retries, redelivery, replay) changes nothing the second time. Signals arriving out of
 * order end in the same state as in-order arrival because the fold sorts by occurrence time.
 *
 * Any failure rolls the whole transaction back: no partial score or assignment is ever visible,
 * and the collected signal stays in the log for the next attempt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProspectRecomputeService {

    private static final String COMPONENT = "ProspectRecomputeService";

    private final ProspectRepository prospectRepository;
    private final OpportunityRecordRepository opportunityRepository;
    private final AnalysisSnapshotRepository snapshotRepository;
    private final EngagementEventRepository engagementEventRepository;
    private final ScoreRecordRepository scoreRecordRepository;
    private final CampaignAssignmentRepository assignmentRepository;
    private final LeadScoreCalculator leadScoreCalculator;
    private final ScoringEngine scoringEngine;
    private final EngagementStateFolder engagementStateFolder;
    private final ProspectLifecycle lifecycle;
    private final CampaignAssignmentResolver assignmentResolver;
    private final OutboxEventWriter outboxEventWriter;
    private final ScoreQueryService scoreQueryService;
    private final Clock clock;

    @Transactional
    public RecomputeOutcome recompute(RecomputeRequest request) {
        String tenantId = request.tenantId();
        String prospectId = request.prospectId();
        log.info("Recomputing prospect {} (tenant {}, trigger {})", prospectId, tenantId, request.trigger());

        Prospect prospect = prospectRepository.lockForRecompute(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));

        List<OpportunityRecord> opportunities = opportunityRepository.findByTenantIdAndProspectId(tenantId, prospectId);
        List<AnalysisSnapshot> snapshots = snapshotRepository.findByTenantIdAndProspectId(tenantId, prospectId);
        List<EngagementEvent> engagementLog = engagementEventRepository.findByTenantIdAndProspectId(tenantId, prospectId);
        Instant now = Instant.now(clock);

        // ==================== SCORES ====================

        LeadScoreBreakdown leadScore = leadScoreCalculator.calculate(
                prospect.getCompanySize(), opportunities, snapshots);
        int engagementScore = scoringEngine.prospectEngagementScore(engagementLog, now);
        EngagementState engagementState = engagementStateFolder.fold(engagementLog);

        ScoreRecord scoreRecord = scoreRecordRepository.findByTenantIdAndProspectId(tenantId, prospectId)
                .orElse(null);
        boolean scoreChanged = scoreRecord == null
                || scoreRecord.getLeadScore() != leadScore.total()
                || scoreRecord.getEngagementScore() != engagementScore
                || scoreRecord.getTemperature() != engagementState.temperature()
                || scoreRecord.getLeadStatus() != engagementState.leadStatus();

        if (scoreChanged) {
            if (scoreRecord == null) {
                scoreRecord = new ScoreRecord();
                scoreRecord.setProspectId(prospectId);
                scoreRecord.setTenantId(tenantId);
            }
            scoreRecord.setLeadScore(leadScore.total());
            scoreRecord.setEngagementScore(engagementScore);
            scoreRecord.setTemperature(engagementState.temperature());
            scoreRecord.setLeadStatus(engagementState.leadStatus());
            scoreRecord.setComputedAt(now);
            scoreRecord = scoreRecordRepository.save(scoreRecord);

            outboxEventWriter.enqueue(KafkaTopics.SCORE_UPDATED, prospectId, new ProspectRescored(
                    tenantId, prospectId, leadScore.total(), engagementScore,
                    engagementState.temperature(), engagementState.leadStatus(), now));
            log.info("Prospect {} rescored: lead={}, engagement={}, temperature={}, status={}",
                     prospectId, leadScore.total(), engagementScore,
                     engagementState.temperature(), engagementState.leadStatus());
        }

        // ==================== STAGE ====================

        List<StageTransition> transitions = lifecycle.catchUpWithAnalysis(prospect.getStage(), snapshots.size());
        for (StageTransition transition : transitions) {
            outboxEventWriter.enqueue(KafkaTopics.STAGE_CHANGED, prospectId, new ProspectStageChanged(
                    tenantId, prospectId, transition.from(), transition.to(), "analysis", now));
            log.info("Prospect {} moved {} -> {}", prospectId, transition.from(), transition.to());
        }
        if (!transitions.isEmpty()) {
            prospect.setStage(transitions.get(transitions.size() - 1).to());
            prospect.setStageChangedAt(now);
            prospectRepository.save(prospect);
        }

        // ==================== ASSIGNMENT ====================

        AssignmentDecision decision = assignmentResolver.resolve(new AssignmentInputs(
                leadScore.total(),
                roiPotential(opportunities),
                prospect.getIndustry(),
                prospect.getCompanySize(),
                opportunities.size()));

        Optional<CampaignAssignment> current = assignmentRepository
                .findFirstByTenantIdAndProspectIdOrderByAssignedAtDesc(tenantId, prospectId);
        boolean assignmentChanged = current.isEmpty() || !decision.sameTreatmentAs(current.get());

        CampaignAssignment assignment;
        if (assignmentChanged) {
            assignment = appendAssignment(tenantId, prospectId, decision, leadScore.total(),
                    roiPotential(opportunities), opportunities.size(), now);
        } else {
            assignment = current.get();
            log.debug("Assignment for prospect {} unchanged ({})", prospectId, assignment.getCampaignId());
        }

        if (scoreChanged || assignmentChanged || !transitions.isEmpty()) {
            scoreQueryService.evict(tenantId, prospectId);
        }

        return new RecomputeOutcome(
                ScoreView.of(scoreRecord, prospect.getStage()),
                AssignmentView.of(assignment),
                transitions,
                scoreChanged,
                assignmentChanged);
    }

    private CampaignAssignment appendAssignment(String tenantId, String prospectId, AssignmentDecision decision,
                                                int leadScore, BigDecimal roiPotential, int opportunityCount,
                                                Instant now) {
        CampaignAssignment assignment = new CampaignAssignment();
        assignment.setAssignmentId(UUID.randomUUID().toString());
        assignment.setTenantId(tenantId);
        assignment.setProspectId(prospectId);
        assignment.setCampaignId(decision.campaignId());
        assignment.setSequenceId(decision.sequenceId());
        assignment.setDelayHours(decision.delayHours());
        assignment.setPriority(decision.priority());
        assignment.setReason(decision.reason());
        assignment.setLeadScore(leadScore);
        assignment.setRoiPotential(roiPotential);
        assignment.setOpportunityCount(opportunityCount);
        assignment.setAssignedAt(now);
        assignmentRepository.save(assignment);

        outboxEventWriter.enqueue(KafkaTopics.CAMPAIGN_ASSIGNED, prospectId, new CampaignAssigned(
                assignment.getAssignmentId(), tenantId, prospectId, decision.campaignId(),
                decision.sequenceId(), decision.delayHours(), decision.priority(), decision.reason(), now));
        log.info("Prospect {} assigned to {} / {} (delay {}h, priority {})", prospectId,
                 decision.campaignId(), decision.sequenceId(), decision.delayHours(), decision.priority());
        return assignment;
    }

    static BigDecimal roiPotential(List<OpportunityRecord> opportunities) {
        return opportunities.stream()
                .map(OpportunityRecord::getRoiEstimate)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
