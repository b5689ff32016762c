package com.flagship.pledge_compliance.donor;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for donors.
 */
@Repository
public interface DonorRepository extends JpaRepository<DonorEntity, UUID> {

    Optional<DonorEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    List<DonorEntity> findByState(String state);

    /**
     * Loads a donor with a row lock (SELECT ... FOR UPDATE).
     * Concurrent pledges by the same donor queue on this lock, so two of them
     * can never both pass an aggregate check that only one of them fits under.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DonorEntity d WHERE d.id = :id")
    Optional<DonorEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Clears the sticky PAC flag for every donor. Runs once a year.
     *
     * @return Number of donors whose flag was cleared
     */
    @Modifying
    @Query("UPDATE DonorEntity d SET d.tipLimitReached = false, d.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE d.tipLimitReached = true")
    int resetTipLimitReached();
}
