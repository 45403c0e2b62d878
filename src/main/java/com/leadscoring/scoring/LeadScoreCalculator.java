package com.leadscoring.scoring;

import com.leadscoring.model.AnalysisSnapshot;
import com.leadscoring.model.AnalysisType;
import com.leadscoring.model.CompanySize;
import com.leadscoring.model.OpportunityRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lead score from firmographic and opportunity signals.
 *
 * <pre>
 * company size        0-25   enterprise 25, large 20, medium 15, small 10, anything else 5
 * opportunities       0-35   min(35, avg(priority_score) * 0.35)
 * analysis coverage   0-25   distinct completed analysis types: 3+ 25, 2 20, 1 15, 0 0
 * service fit         0-15   min(15, opportunities with a service tier * 5)
 * </pre>
 *
 * Pure: same inputs, same result.
 */
@Component
public class LeadScoreCalculator {

    static final double MAX_OPPORTUNITY_POINTS = 35.0;
    static final double OPPORTUNITY_WEIGHT = 0.35;
    static final double MAX_SERVICE_FIT_POINTS = 15.0;
    static final double POINTS_PER_TIERED_OPPORTUNITY = 5.0;

    public LeadScoreBreakdown calculate(CompanySize companySize,
                                        Collection<OpportunityRecord> opportunities,
                                        Collection<AnalysisSnapshot> snapshots) {

        double sizePoints = companySizePoints(companySize);
        double opportunityPoints = opportunityPoints(opportunities);
        int completedTypes = completedAnalysisTypes(snapshots);
        double analysisPoints = analysisPoints(completedTypes);
        double serviceFitPoints = serviceFitPoints(opportunities);

        int total = ScoreMath.clampScore(sizePoints + opportunityPoints + analysisPoints + serviceFitPoints);

        return new LeadScoreBreakdown(
                sizePoints,
                opportunityPoints,
                analysisPoints,
                serviceFitPoints,
                opportunities == null ? 0 : opportunities.size(),
                completedTypes,
                total
        );
    }

    double companySizePoints(CompanySize companySize) {
        if (companySize == null) {
            return 5;
        }
        return switch (companySize) {
            case ENTERPRISE -> 25;
            case LARGE -> 20;
            case MEDIUM -> 15;
            case SMALL -> 10;
            case STARTUP, UNKNOWN -> 5;
        };
    }

    double opportunityPoints(Collection<OpportunityRecord> opportunities) {
        if (opportunities == null || opportunities.isEmpty()) {
            return 0.0;
        }
        double average = opportunities.stream()
                .map(OpportunityRecord::getPriorityScore)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
        return Math.min(MAX_OPPORTUNITY_POINTS, average * OPPORTUNITY_WEIGHT);
    }

    /**
     * Distinct analysis types whose latest snapshot is completed.
     * Older versions of a type are ignored, so a failed re-run un-counts that type.
     */
    int completedAnalysisTypes(Collection<AnalysisSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return 0;
        }
        Map<AnalysisType, AnalysisSnapshot> latest = new EnumMap<>(AnalysisType.class);
        Comparator<AnalysisSnapshot> byVersion = Comparator.comparing(AnalysisSnapshot::getVersion);
        for (AnalysisSnapshot snapshot : snapshots) {
            if (snapshot.getAnalysisType() == null || snapshot.getVersion() == null) {
                continue;
            }
            latest.merge(snapshot.getAnalysisType(), snapshot,
                    (current, candidate) -> byVersion.compare(candidate, current) > 0 ? candidate : current);
        }
        return (int) latest.values().stream()
                .filter(s -> Boolean.TRUE.equals(s.getCompleted()))
                .count();
    }

    double analysisPoints(int completedTypes) {
        if (completedTypes >= 3) {
            return 25;
        } else if (completedTypes == 2) {
            return 20;
        } else if (completedTypes == 1) {
            return 15;
        }
        return 0;
    }

    double serviceFitPoints(Collection<OpportunityRecord> opportunities) {
        if (opportunities == null) {
            return 0.0;
        }
        long tiered = opportunities.stream()
                .filter(o -> o.getServiceTier() != null)
                .count();
        return Math.min(MAX_SERVICE_FIT_POINTS, tiered * POINTS_PER_TIERED_OPPORTUNITY);
    }
}
