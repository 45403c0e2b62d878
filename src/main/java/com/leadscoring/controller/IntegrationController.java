package com.leadscoring.controller;

import com.leadscoring.scoring.EngagementScoreBreakdown;
import com.leadscoring.scoring.ScoringEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engagement of one integration (outreach mailbox / channel identity), across all its prospects.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/integrations")
@RequiredArgsConstructor
public class IntegrationController {

    private final ScoringEngine scoringEngine;

    @GetMapping("/{integrationId}/engagement")
    public ResponseEntity<EngagementScoreBreakdown> getEngagement(
            @PathVariable String tenantId, @PathVariable String integrationId) {
        return ResponseEntity.ok(scoringEngine.engagementScore(tenantId, integrationId));
    }
}
