package com.leadscoring.service;

import com.leadscoring.config.RedisConfig;
import com.leadscoring.exception.ProspectNotFoundException;
import com.leadscoring.model.Prospect;
import com.leadscoring.model.ScoreRecord;
import com.leadscoring.repository.CampaignAssignmentRepository;
import com.leadscoring.repository.ProspectRepository;
import com.leadscoring.repository.ScoreRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cached reads of scores and assignment history.
 *
 * CACHE-ASIDE:
 * ============
 * 1. Look up "scores" / "assignments" in Redis under tenantId:prospectId
 * 2. On a miss, read the database and populate the cache
 * 3. Every recompute evicts both entries (after commit, see RedisConfig)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoreQueryService {

    private static final String COMPONENT = "ScoreQueryService";

    private final ProspectRepository prospectRepository;
    private final ScoreRecordRepository scoreRecordRepository;
    private final CampaignAssignmentRepository assignmentRepository;

    @Cacheable(value = RedisConfig.SCORES_CACHE, key = "#tenantId + ':' + #prospectId")
    @Transactional(readOnly = true)
    public ScoreView getScore(String tenantId, String prospectId) {
        log.debug("Cache miss for score {}:{}", tenantId, prospectId);

        Prospect prospect = prospectRepository.findByTenantIdAndProspectId(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));
        ScoreRecord record = scoreRecordRepository.findByTenantIdAndProspectId(tenantId, prospectId)
                .orElseThrow(() -> new ProspectNotFoundException(COMPONENT, tenantId, prospectId));
        return ScoreView.of(record, prospect.getStage());
    }

    /**
     * Assignment history, newest first. The first entry is the current assignment.
     */
    @Cacheable(value = RedisConfig.ASSIGNMENTS_CACHE, key = "#tenantId + ':' + #prospectId")
    @Transactional(readOnly = true)
    public List<AssignmentView> getAssignmentHistory(String tenantId, String prospectId) {
        log.debug("Cache miss for assignments {}:{}", tenantId, prospectId);

        if (!prospectRepository.existsByTenantIdAndProspectId(tenantId, prospectId)) {
            throw new ProspectNotFoundException(COMPONENT, tenantId, prospectId);
        }
        return assignmentRepository.findByTenantIdAndProspectIdOrderByAssignedAtDesc(tenantId, prospectId)
                .stream()
                .map(AssignmentView::of)
                .collect(Collectors.toList());
    }

    @CacheEvict(cacheNames = {RedisConfig.SCORES_CACHE, RedisConfig.ASSIGNMENTS_CACHE},
                key = "#tenantId + ':' + #prospectId")
    public void evict(String tenantId, String prospectId) {
        log.debug("Evicting cached score and assignments for {}:{}", tenantId, prospectId);
    }
}
