package com.leadscoring.repository;

import com.leadscoring.model.Prospect;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProspectRepository extends JpaRepository<Prospect, Long> {

    Optional<Prospect> findByTenantIdAndProspectId(String tenantId, String prospectId);

    boolean existsByTenantIdAndProspectId(String tenantId, String prospectId);

    /**
     * Load the prospect row with SELECT ... FOR UPDATE.
     * Holding this lock for the whole recompute transaction serializes recomputes per prospect.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Prospect p WHERE p.tenantId = :tenantId AND p.prospectId = :prospectId")
    Optional<Prospect> lockForRecompute(@Param("tenantId") String tenantId,
                                        @Param("prospectId") String prospectId);
}
