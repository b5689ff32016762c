package com.flagship.pledge_compliance.celebration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_compliance.compliance.PledgeHistoryStore;
import com.flagship.pledge_compliance.compliance.PledgeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Celebration domain object and its two tables.
 *
 * A celebration and its ledger are always read together and always written in the
 * caller's transaction: a pledge row never exists without its creation entry, and a
 * status write never lands without its ledger entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CelebrationPersistenceService implements PledgeHistoryStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final CelebrationRepository celebrationRepository;
    private final StatusLedgerRepository ledgerRepository;
    private final ObjectMapper objectMapper;

    /**
     * Inserts a new celebration and its creation ledger entry.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Celebration create(Celebration celebration, String idempotencyKey) {
        CelebrationEntity entity = CelebrationEntity.fromDomain(
            celebration, toJson(celebration.getDonorInfo()), idempotencyKey);
        celebrationRepository.save(entity);
        for (StatusLedgerEntry entry : celebration.getStatusLedger()) {
            appendEntry(entry);
        }
        log.debug("Saved celebration {} with idempotency key {}", celebration.getId(), idempotencyKey);
        return celebration;
    }

    /**
     * Persists a transition computed by {@link Celebration#transition}.
     *
     * @throws ConcurrentStatusChangeException if the stored status is no longer {@code before}'s
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyTransition(Celebration before, Celebration after) {
        int updated = celebrationRepository.transitionStatus(
            after.getId(),
            before.getCurrentStatus(),
            after.getCurrentStatus(),
            after.isResolved(),
            after.isPaused(),
            after.isDefunct(),
            after.getDefunctDate(),
            after.getDefunctReason(),
            after.getUpdatedAt()
        );
        if (updated == 0) {
            throw new ConcurrentStatusChangeException(after.getId(), before.getCurrentStatus());
        }
        appendEntry(after.latestEntry());
    }

    @Transactional(readOnly = true)
    public Optional<Celebration> findById(UUID celebrationId) {
        return celebrationRepository.findById(celebrationId).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Celebration> findByIdempotencyKey(String idempotencyKey) {
        return celebrationRepository.findByIdempotencyKey(idempotencyKey).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Celebration> findNonSeedByStatus(Collection<CelebrationStatus> statuses) {
        return celebrationRepository.findNonSeedByStatusIn(statuses).stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findDonorsWithActivePledgesTo(Collection<String> politicianIds) {
        if (politicianIds.isEmpty()) {
            return List.of();
        }
        return celebrationRepository.findDonorIdsWithPledgesTo(politicianIds, CelebrationStatus.ACTIVE);
    }

    /**
     * Newest-first slice of a celebration's ledger.
     */
    @Transactional(readOnly = true)
    public List<StatusLedgerEntry> findRecentEntries(UUID celebrationId, int limit) {
        return ledgerRepository.findRecent(celebrationId, PageRequest.of(0, limit)).stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countEntries(UUID celebrationId) {
        return ledgerRepository.countByCelebrationId(celebrationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PledgeRecord> findByDonor(UUID donorId) {
        return celebrationRepository.findByDonorId(donorId).stream()
            .map(entity -> PledgeRecord.builder()
                .celebrationId(entity.getId())
                .donationAmount(entity.getDonationAmount())
                .tipAmount(entity.getTipAmount())
                .recipientId(entity.getPoliticianId())
                .createdAt(entity.getCreatedAt())
                .defunct(entity.isDefunct())
                .paused(entity.isPaused())
                .resolved(entity.isResolved())
                .build())
            .toList();
    }

    private void appendEntry(StatusLedgerEntry entry) {
        ledgerRepository.save(StatusLedgerEntryEntity.fromDomain(
            entry, toJson(entry.getMetadata()), toJson(entry.getAuditTrail())));
    }

    private Celebration toDomain(CelebrationEntity entity) {
        List<StatusLedgerEntry> ledger = ledgerRepository
            .findByCelebrationIdOrderBySequenceNumberAsc(entity.getId()).stream()
            .map(this::toDomain)
            .toList();
        return entity.toDomain(fromJson(entity.getDonorInfo(), DonorInfoSnapshot.class), ledger);
    }

    private StatusLedgerEntry toDomain(StatusLedgerEntryEntity entity) {
        return StatusLedgerEntry.builder()
            .statusChangeId(entity.getStatusChangeId())
            .celebrationId(entity.getCelebrationId())
            .sequenceNumber(entity.getSequenceNumber())
            .previousStatus(entity.getPreviousStatus())
            .newStatus(entity.getNewStatus())
            .changedAt(entity.getChangedAt())
            .reason(entity.getReason())
            .triggeredBy(entity.getTriggeredBy())
            .triggeredById(entity.getTriggeredById())
            .triggeredByName(entity.getTriggeredByName())
            .metadata(readMetadata(entity.getMetadata()))
            .complianceTierAtTime(entity.getComplianceTierAtTime())
            .fecCompliant(entity.isFecCompliant())
            .auditTrail(fromJson(entity.getAuditTrail(), AuditTrail.class))
            .build();
    }

    private Map<String, Object> readMetadata(String json) {
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger metadata", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored " + type.getSimpleName(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
