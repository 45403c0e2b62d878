package com.leadscoring.service;

import com.leadscoring.config.KafkaTopics;
import com.leadscoring.event.ProspectStageChanged;
import com.leadscoring.event.RecomputeRequest;
import com.leadscoring.exception.ProspectNotFoundException;
import com.leadscoring.exception.StageTransitionException;
import com.leadscoring.lifecycle.ProspectLifecycle;
import com.leadscoring.lifecycle.StageTransition;
import com.leadscoring.model.CompanySize;
import com.leadscoring.model.OpportunityRecord;
import com.leadscoring.model.Prospect;
import com.leadscoring.model.ProspectStage;
import com.leadscoring.model.ServiceTier;
import com.leadscoring.repository.OpportunityRecordRepository;
import com.leadscoring.repository.ProspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Prospect registration, opportunity intake and sales-driven stage changes.
 *
 * Registration and opportunity intake end with a recompute so the prospect has a score and an
 * assignment as soon as it is known.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProspectService {

    private static final String COMPONENT = "ProspectService";

    private final ProspectRepository prospectRepository;
    private final OpportunityRecordRepository opportunityRepository;
    private final ProspectLifecycle lifecycle;
    private final ProspectRecomputeService recomputeService;
    private final OutboxEventWriter outboxEventWriter;
    private final Clock clock;

    public record RegisterProspectCommand(
        String tenantId,
        String prospectId,
        String name,
        String industry,
        String companySize,
        String revenueBand
    ) {
    }

    public record OpportunityCommand(
        String processName,
        int priorityScore,
        ServiceTier serviceTier,
        BigDecimal roiEstimate
    ) {
    }

    /**
     * Create the prospect on first sighting; later calls refresh the firmographics.
     * Stage is never touched here.
     */
    @Transactional
    public RecomputeOutcome register(RegisterProspectCommand command) {
        Prospect prospect = prospectRepository.findByTenantIdAndProspectId(command.tenantId(), command.prospectId())
                .orElseGet(() -> {
                    Prospect created = new Prospect();
                    created.setTenantId(command.tenantId());
                    created.setProspectId(command.prospectId());
                    created.setCreatedAt(Instant.now(clock));
                    log.info("Registering prospect {} for tenant {}", command.prospectId(), command.tenantId());
                    return created;
                });

        prospect.setName(command.name());
        prospect.setIndustry(command.industry());
        prospect.setCompanySize(CompanySize.fromValue(command.companySize()));
        prospect.setRevenueBand(command.revenueBand());
        prospectRepository.save(prospect);

        return recomputeService.recompute(new RecomputeRequest(
                command.tenantId(), command.prospectId(), RecomputeRequest.Trigger.PROSPECT_REGISTERED));
    }

    @Transactional
    public RecomputeOutcome addOpportunities(String tenantId, String prospectId, List<OpportunityCommand> commands) {
        requireProspect(tenantId, prospectId);
        Instant now = Instant.now(clock);

        for (OpportunityCommand command : commands) {
            OpportunityRecord record = new OpportunityRecord();
            record.setOpportunityId(UUID.randomUUID().toString());
            record.setTenantId(tenantId);
            record.setProspectId(prospectId);
            record.setProcessName(command.processName());
            record.setPriorityScore(command.priorityScore());
            record.setServiceTier(command.serviceTier());
            record.setRoiEstimate(command.roiEstimate());
            record.setCreatedAt(now);
            opportunityRepository.save(record);
        }
        log.info("Added {} opportunities to prospect {}", commands.size(), prospectId);

        return recomputeService.recompute(new RecomputeRequest(
                tenantId, prospectId, RecomputeRequest.Trigger.OPPORTUNITIES_CHANGED));
    }

    /**
     * Sales action (contacted, qualified, disqualified, converted).
     *
     * @return the transition, empty if the prospect already was at the target
     * @throws StageTransitionException when the lifecycle forbids the move
     */
    @Transactional
    public Optional<StageTransition> moveToStage(String tenantId, String prospectId, ProspectStage target) {
        Prospect prospect = prospectRepository.lockForRecompute(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));

        Optional<StageTransition> transition = lifecycle.advanceBySalesAction(prospectId, prospect.getStage(), target);
        transition.ifPresent(t -> {
            Instant now = Instant.now(clock);
            prospect.setStage(t.to());
            prospect.setStageChangedAt(now);
            prospectRepository.save(prospect);
            outboxEventWriter.enqueue(KafkaTopics.STAGE_CHANGED, prospectId, new ProspectStageChanged(
                    tenantId, prospectId, t.from(), t.to(), "sales", now));
            log.info("Prospect {} moved {} -> {} by sales", prospectId, t.from(), t.to());
        });
        return transition;
    }

    @Transactional(readOnly = true)
    public Prospect getProspect(String tenantId, String prospectId) {
        return requireProspect(tenantId, prospectId);
    }

    private Prospect requireProspect(String tenantId, String prospectId) {
        return prospectRepository.findByTenantIdAndProspectId(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));
    }
}
