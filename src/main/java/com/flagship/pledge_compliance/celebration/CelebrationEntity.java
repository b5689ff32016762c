package com.flagship.pledge_compliance.celebration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for celebrations.
 *
 * No setters and no update hook: after insert the status columns only change through
 * {@link CelebrationRepository#transitionStatus}, a single conditional UPDATE that
 * writes currentStatus, the three legacy flags and the defunct details together.
 * Amounts, donor snapshot and idempotency key are insert-only.
 */
@Entity
@Table(
    name = "celebrations",
    indexes = {
        @Index(name = "idx_celebrations_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_celebrations_donor", columnList = "donor_id"),
        @Index(name = "idx_celebrations_status", columnList = "current_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CelebrationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "donor_id", nullable = false, updatable = false)
    private UUID donorId;

    @Column(name = "politician_id", nullable = false, updatable = false)
    private String politicianId;

    @Column(name = "bill_id", nullable = false, updatable = false)
    private String billId;

    @Column(name = "state", length = 2, updatable = false)
    private String state;

    @Column(name = "donation_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal donationAmount;

    @Column(name = "tip_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal tipAmount;

    @Column(name = "fee", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal fee;

    @Column(name = "donor_info", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String donorInfo;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_status", nullable = false, length = 16)
    private CelebrationStatus currentStatus;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "defunct", nullable = false)
    private boolean defunct;

    @Column(name = "defunct_date")
    private Instant defunctDate;

    @Column(name = "defunct_reason", columnDefinition = "TEXT")
    private String defunctReason;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    /**
     * Controlled factory. The donor snapshot arrives already serialized so the
     * stored JSON is exactly what was validated.
     */
    static CelebrationEntity fromDomain(Celebration celebration, String donorInfoJson, String idempotencyKey) {
        CelebrationStatus status = celebration.getCurrentStatus();
        return new CelebrationEntity(
            celebration.getId(),
            celebration.getDonorId(),
            celebration.getPoliticianId(),
            celebration.getBillId(),
            celebration.getState(),
            celebration.getDonationAmount(),
            celebration.getTipAmount(),
            celebration.getFee(),
            donorInfoJson,
            status,
            status == CelebrationStatus.RESOLVED,
            status == CelebrationStatus.PAUSED,
            status == CelebrationStatus.DEFUNCT,
            celebration.getDefunctDate(),
            celebration.getDefunctReason(),
            idempotencyKey,
            celebration.getCreatedAt(),
            celebration.getUpdatedAt()
        );
    }

    Celebration toDomain(DonorInfoSnapshot snapshot, List<StatusLedgerEntry> ledger) {
        return Celebration.builder()
            .id(id)
            .donorId(donorId)
            .politicianId(politicianId)
            .billId(billId)
            .state(state)
            .donationAmount(donationAmount)
            .tipAmount(tipAmount)
            .fee(fee)
            .donorInfo(snapshot)
            .currentStatus(currentStatus)
            .statusLedger(List.copyOf(ledger))
            .defunctDate(defunctDate)
            .defunctReason(defunctReason)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
