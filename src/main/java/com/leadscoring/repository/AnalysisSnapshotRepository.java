package com.leadscoring.repository;

import com.leadscoring.model.AnalysisSnapshot;
import com.leadscoring.model.AnalysisType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisSnapshotRepository extends JpaRepository<AnalysisSnapshot, String> {

    List<AnalysisSnapshot> findByTenantIdAndProspectId(String tenantId, String prospectId);

    /**
     * Latest version recorded for one analysis type; used for the monotonic version check.
     */
    Optional<AnalysisSnapshot> findFirstByTenantIdAndProspectIdAndAnalysisTypeOrderByVersionDesc(
            String tenantId, String prospectId, AnalysisType analysisType);
}
