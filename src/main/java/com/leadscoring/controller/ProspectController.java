package com.leadscoring.controller;

import com.leadscoring.event.ActivitySignal;
import com.leadscoring.event.AnalysisSignal;
import com.leadscoring.lifecycle.StageTransition;
import com.leadscoring.model.Prospect;
import com.leadscoring.model.ProspectStage;
import com.leadscoring.model.ServiceTier;
import com.leadscoring.scoring.LeadScoreBreakdown;
import com.leadscoring.scoring.ScoringEngine;
import com.leadscoring.service.AssignmentView;
import com.leadscoring.service.ProspectService;
import com.leadscoring.service.RecomputeOutcome;
import com.leadscoring.service.ScoreQueryService;
import com.leadscoring.service.ScoreView;
import com.leadscoring.service.SignalIngestionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * REST entry point for prospects. Every path is tenant-scoped.
 *
 * Signals posted here go through the same collector + recompute path as the Kafka listeners,
 * but synchronously: the response carries the recomputed score.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/prospects")
@RequiredArgsConstructor
@Slf4j
public class ProspectController {

    private final ProspectService prospectService;
    private final SignalIngestionService ingestionService;
    private final ScoreQueryService scoreQueryService;
    private final ScoringEngine scoringEngine;

    /**
     * Register a prospect, or refresh its firmographics.
     *
     * PUT /api/tenants/{tenantId}/prospects/{prospectId}
     * {
     *   "name": "Acme Legal LLP",
     *   "industry": "Legal Services",
     *   "companySize": "medium",
     *   "revenueBand": "10M-50M"
     * }
     */
    @PutMapping("/{prospectId}")
    public ResponseEntity<RecomputeResponse> registerProspect(
            @PathVariable String tenantId,
            @PathVariable String prospectId,
            @Valid @RequestBody ProspectRequest request) {

        log.info("Register request for prospect {} (tenant {})", prospectId, tenantId);
        RecomputeOutcome outcome = prospectService.register(new ProspectService.RegisterProspectCommand(
                tenantId, prospectId, request.getName(), request.getIndustry(),
                request.getCompanySize(), request.getRevenueBand()));
        return ResponseEntity.ok(RecomputeResponse.of(outcome));
    }

    @GetMapping("/{prospectId}")
    public ResponseEntity<Prospect> getProspect(@PathVariable String tenantId, @PathVariable String prospectId) {
        return ResponseEntity.ok(prospectService.getProspect(tenantId, prospectId));
    }

    @PostMapping("/{prospectId}/opportunities")
    public ResponseEntity<RecomputeResponse> addOpportunities(
            @PathVariable String tenantId,
            @PathVariable String prospectId,
            @Valid @RequestBody OpportunitiesRequest request) {

        List<ProspectService.OpportunityCommand> commands = request.getOpportunities().stream()
                .map(o -> new ProspectService.OpportunityCommand(
                        o.getProcessName(), o.getPriorityScore(), o.getServiceTier(), o.getRoiEstimate()))
                .toList();
        return ResponseEntity.ok(RecomputeResponse.of(prospectService.addOpportunities(tenantId, prospectId, commands)));
    }

    /**
     * Post one email activity (sent, opened, clicked, replied, bounced, unsubscribed, complained).
     * A redelivered activity is answered with duplicate=true and changes nothing.
     */
    @PostMapping("/{prospectId}/activities")
    public ResponseEntity<SignalResponse> postActivity(
            @PathVariable String tenantId,
            @PathVariable String prospectId,
            @RequestBody ActivityRequest request) {

        SignalIngestionService.IngestionResult result = ingestionService.ingestActivity(new ActivitySignal(
                tenantId, prospectId, request.getIntegrationId(), request.getExternalActivityId(),
                request.getKind(), request.getOccurredAt(), request.getReplyContent()));
        return ResponseEntity.ok(SignalResponse.of(result));
    }

    @PostMapping("/{prospectId}/analyses")
    public ResponseEntity<SignalResponse> postAnalysis(
            @PathVariable String tenantId,
            @PathVariable String prospectId,
            @RequestBody AnalysisRequest request) {

        SignalIngestionService.IngestionResult result = ingestionService.ingestAnalysis(new AnalysisSignal(
                tenantId, prospectId, request.getAnalysisType(), request.getVersion(), request.getCompleted(),
                request.getContentQualityScore(), request.getAnalyzedAt()));
        return ResponseEntity.ok(SignalResponse.of(result));
    }

    @GetMapping("/{prospectId}/score")
    public ResponseEntity<ScoreView> getScore(@PathVariable String tenantId, @PathVariable String prospectId) {
        return ResponseEntity.ok(scoreQueryService.getScore(tenantId, prospectId));
    }

    /**
     * Term-by-term lead score, computed live (not cached).
     */
    @GetMapping("/{prospectId}/score/breakdown")
    public ResponseEntity<LeadScoreBreakdown> getLeadScoreBreakdown(
            @PathVariable String tenantId, @PathVariable String prospectId) {
        return ResponseEntity.ok(scoringEngine.leadScore(tenantId, prospectId));
    }

    @GetMapping("/{prospectId}/assignments")
    public ResponseEntity<List<AssignmentView>> getAssignments(
            @PathVariable String tenantId, @PathVariable String prospectId) {
        return ResponseEntity.ok(scoreQueryService.getAssignmentHistory(tenantId, prospectId));
    }

    /**
     * Sales action. 409 when the move is not allowed (backward, out of a terminal stage, or into
     * an analysis-only stage).
     */
    @PostMapping("/{prospectId}/stage")
    public ResponseEntity<StageResponse> moveToStage(
            @PathVariable String tenantId,
            @PathVariable String prospectId,
            @Valid @RequestBody StageRequest request) {

        Optional<StageTransition> transition = prospectService.moveToStage(tenantId, prospectId, request.getStage());
        StageResponse response = new StageResponse();
        response.setStage(request.getStage());
        response.setChanged(transition.isPresent());
        transition.ifPresent(t -> response.setPreviousStage(t.from()));
        return ResponseEntity.ok(response);
    }

    // ==================== DTOs ====================

    @Data
    public static class ProspectRequest {
        @NotBlank(message = "Name is required")
        private String name;

        private String industry;

        // enterprise | large | medium | small | startup, anything else is unknown
        private String companySize;

        private String revenueBand;
    }

    @Data
    public static class OpportunitiesRequest {
        @NotEmpty(message = "At least one opportunity is required")
        private List<@Valid OpportunityRequest> opportunities;
    }

    @Data
    public static class OpportunityRequest {
        @NotBlank(message = "Process name is required")
        private String processName;

        @NotNull(message = "Priority score is required")
        @Min(value = 1, message = "Priority score must be at least 1")
        @Max(value = 100, message = "Priority score must be at most 100")
        private Integer priorityScore;

        private ServiceTier serviceTier;

        @DecimalMin(value = "0", message = "ROI estimate must not be negative")
        private BigDecimal roiEstimate;
    }

    // Signal bodies are validated by the collector so REST and Kafka reject the same way
    @Data
    public static class ActivityRequest {
        private String integrationId;
        private String externalActivityId;
        private String kind;
        private Instant occurredAt;
        private String replyContent;
    }

    @Data
    public static class AnalysisRequest {
        private String analysisType;
        private Integer version;
        private Boolean completed;
        private Integer contentQualityScore;
        private Instant analyzedAt;
    }

    @Data
    public static class StageRequest {
        @NotNull(message = "Target stage is required")
        private ProspectStage stage;
    }

    @Data
    public static class StageResponse {
        private ProspectStage previousStage;
        private ProspectStage stage;
        private boolean changed;
    }

    @Data
    public static class RecomputeResponse {
        private ScoreView score;
        private AssignmentView assignment;
        private List<StageTransition> stageTransitions;
        private boolean scoreChanged;
        private boolean assignmentChanged;

        static RecomputeResponse of(RecomputeOutcome outcome) {
            RecomputeResponse response = new RecomputeResponse();
            response.setScore(outcome.score());
            response.setAssignment(outcome.assignment());
            response.setStageTransitions(outcome.stageTransitions());
            response.setScoreChanged(outcome.scoreChanged());
            response.setAssignmentChanged(outcome.assignmentChanged());
            return response;
        }
    }

    @Data
    public static class SignalResponse {
        private String recordId;
        private boolean duplicate;
        private RecomputeResponse recompute;

        static SignalResponse of(SignalIngestionService.IngestionResult result) {
            SignalResponse response = new SignalResponse();
            response.setRecordId(result.collection().recordId());
            response.setDuplicate(result.collection().duplicate());
            result.recompute().ifPresent(outcome -> response.setRecompute(RecomputeResponse.of(outcome)));
            return response;
        }
    }
}
