package com.leadscoring.repository;

import com.leadscoring.model.OpportunityRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OpportunityRecordRepository extends JpaRepository<OpportunityRecord, String> {

    List<OpportunityRecord> findByTenantIdAndProspectId(String tenantId, String prospectId);
}
