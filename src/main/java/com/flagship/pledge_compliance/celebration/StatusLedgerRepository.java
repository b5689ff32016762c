package com.flagship.pledge_compliance.celebration;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read and append access to status ledgers. Rows are insert-only.
 */
@Repository
public interface StatusLedgerRepository extends JpaRepository<StatusLedgerEntryEntity, UUID> {

    List<StatusLedgerEntryEntity> findByCelebrationIdOrderBySequenceNumberAsc(UUID celebrationId);

    @Query("""
        SELECT e FROM StatusLedgerEntryEntity e
        WHERE e.celebrationId = :celebrationId
        ORDER BY e.sequenceNumber DESC
        """)
    List<StatusLedgerEntryEntity> findRecent(@Param("celebrationId") UUID celebrationId, Pageable pageable);

    long countByCelebrationId(UUID celebrationId);
}
