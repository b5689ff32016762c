package com.flagship.pledge_compliance.celebration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one status ledger row.
 *
 * Insert-only. Hibernate never issues an UPDATE for it and the database rejects
 * UPDATE and DELETE on the table. (celebration_id, sequence_number) is unique, so two
 * writers racing to append the same position cannot both commit.
 */
@Entity
@Immutable
@Table(
    name = "celebration_status_ledger",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_ledger_celebration_sequence", columnNames = {"celebration_id", "sequence_number"})
    },
    indexes = {
        @Index(name = "idx_ledger_celebration", columnList = "celebration_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusLedgerEntryEntity {

    @Id
    @Column(name = "status_change_id", nullable = false, updatable = false)
    private UUID statusChangeId;

    @Column(name = "celebration_id", nullable = false, updatable = false)
    private UUID celebrationId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    /**
     * NULL for the creation entry.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 16, updatable = false)
    private CelebrationStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 16, updatable = false)
    private CelebrationStatus newStatus;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false, length = 32, updatable = false)
    private TriggerType triggeredBy;

    @Column(name = "triggered_by_id", updatable = false)
    private String triggeredById;

    @Column(name = "triggered_by_name", updatable = false)
    private String triggeredByName;

    @Column(name = "metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "compliance_tier_at_time", nullable = false, length = 32, updatable = false)
    private String complianceTierAtTime;

    @Column(name = "fec_compliant", nullable = false, updatable = false)
    private boolean fecCompliant;

    @Column(name = "audit_trail", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String auditTrail;

    static StatusLedgerEntryEntity fromDomain(StatusLedgerEntry entry, String metadataJson, String auditTrailJson) {
        return new StatusLedgerEntryEntity(
            entry.getStatusChangeId(),
            entry.getCelebrationId(),
            entry.getSequenceNumber(),
            entry.getPreviousStatus(),
            entry.getNewStatus(),
            entry.getChangedAt(),
            entry.getReason(),
            entry.getTriggeredBy(),
            entry.getTriggeredById(),
            entry.getTriggeredByName(),
            metadataJson,
            entry.getComplianceTierAtTime(),
            entry.isFecCompliant(),
            auditTrailJson
        );
    }
}
