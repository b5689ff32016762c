package com.flagship.pledge_compliance.celebration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for celebrations.
 */
@Repository
public interface CelebrationRepository extends JpaRepository<CelebrationEntity, UUID> {

    Optional<CelebrationEntity> findByIdempotencyKey(String idempotencyKey);

    List<CelebrationEntity> findByDonorId(UUID donorId);

    long countByCurrentStatus(CelebrationStatus status);

    /**
     * Donors holding at least one pledge in {@code status} to any of the given recipients.
     */
    @Query("""
        SELECT DISTINCT c.donorId FROM CelebrationEntity c
        WHERE c.politicianId IN :politicianIds
        AND c.currentStatus = :status
        """)
    List<UUID> findDonorIdsWithPledgesTo(@Param("politicianIds") Collection<String> politicianIds,
                                         @Param("status") CelebrationStatus status);

    /**
     * Celebrations in the given statuses, excluding seed data (idempotency key prefixed "seed:").
     */
    @Query("""
        SELECT c FROM CelebrationEntity c
        WHERE c.currentStatus IN :statuses
        AND c.idempotencyKey NOT LIKE 'seed:%'
        ORDER BY c.createdAt ASC
        """)
    List<CelebrationEntity> findNonSeedByStatusIn(@Param("statuses") Collection<CelebrationStatus> statuses);

    /**
     * Conditional status write: applies only if the row is still in {@code expected}.
     * Status, legacy flags and defunct details change in one statement.
     *
     * @return 1 if applied, 0 if another writer moved the status first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE CelebrationEntity c SET
            c.currentStatus = :target,
            c.resolved = :resolved,
            c.paused = :paused,
            c.defunct = :defunct,
            c.defunctDate = :defunctDate,
            c.defunctReason = :defunctReason,
            c.updatedAt = :now
        WHERE c.id = :id AND c.currentStatus = :expected
        """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") CelebrationStatus expected,
                         @Param("target") CelebrationStatus target,
                         @Param("resolved") boolean resolved,
                         @Param("paused") boolean paused,
                         @Param("defunct") boolean defunct,
                         @Param("defunctDate") Instant defunctDate,
                         @Param("defunctReason") String defunctReason,
                         @Param("now") Instant now);
}
