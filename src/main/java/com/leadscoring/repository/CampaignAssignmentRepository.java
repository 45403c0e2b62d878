package com.leadscoring.repository;

import com.leadscoring.model.CampaignAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignAssignmentRepository extends JpaRepository<CampaignAssignment, String> {

    /**
     * Current assignment = newest row.
     */
    Optional<CampaignAssignment> findFirstByTenantIdAndProspectIdOrderByAssignedAtDesc(
            String tenantId, String prospectId);

    List<CampaignAssignment> findByTenantIdAndProspectIdOrderByAssignedAtDesc(String tenantId, String prospectId);
}
