package com.leadscoring.repository;

import com.leadscoring.model.EngagementEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only engagement log.
 *
 * Only inserts and reads: nothing in the engine updates or deletes an event.
 */
@Repository
public interface EngagementEventRepository extends JpaRepository<EngagementEvent, String> {

    /**
     * Dedup check run by the collector before appending.
     */
    boolean existsByTenantIdAndProspectIdAndExternalActivityId(
            String tenantId, String prospectId, String externalActivityId);

    /**
     * Full log of a prospect. Arrival order is irrelevant, the fold sorts by occurrence time.
     */
    List<EngagementEvent> findByTenantIdAndProspectId(String tenantId, String prospectId);

    List<EngagementEvent> findByTenantIdAndIntegrationId(String tenantId, String integrationId);
}
