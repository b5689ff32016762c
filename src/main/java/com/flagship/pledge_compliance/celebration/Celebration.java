package com.flagship.pledge_compliance.celebration;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Celebration (escrowed pledge) domain object.
 *
 * Key invariants:
 * - currentStatus equals the newStatus of the last ledger entry
 * - the ledger only grows, one entry per applied transition
 * - legacy resolved/paused/defunct flags are derived from currentStatus, never set independently
 * - donorInfo is frozen at creation
 *
 * Transitions return a new instance; a rejected transition leaves this one untouched.
 */
@Value
@Builder(toBuilder = true)
public class Celebration {
    UUID id;
    UUID donorId;
    String politicianId;
    String billId;
    String state;
    BigDecimal donationAmount;
    BigDecimal tipAmount;
    BigDecimal fee;
    DonorInfoSnapshot donorInfo;
    CelebrationStatus currentStatus;
    List<StatusLedgerEntry> statusLedger;
    Instant defunctDate;
    String defunctReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates an active celebration together with its "none to active" creation entry.
     */
    public static Celebration create(UUID id, UUID donorId, String politicianId, String billId, String state,
                                     BigDecimal donationAmount, BigDecimal tipAmount, BigDecimal fee,
                                     DonorInfoSnapshot donorInfo, AuditTrail auditTrail, Instant now) {
        if (donationAmount == null || donationAmount.signum() <= 0) {
            throw new IllegalArgumentException("Donation amount must be positive");
        }
        if (tipAmount == null || tipAmount.signum() < 0) {
            throw new IllegalArgumentException("Tip amount must not be negative");
        }

        StatusLedgerEntry creation = StatusLedgerEntry.builder()
            .statusChangeId(UUID.randomUUID())
            .celebrationId(id)
            .sequenceNumber(1)
            .previousStatus(null)
            .newStatus(CelebrationStatus.ACTIVE)
            .changedAt(now)
            .reason("Celebration created")
            .triggeredBy(TriggerType.SYSTEM)
            .triggeredById(donorId != null ? donorId.toString() : null)
            .triggeredByName("System - Creation")
            .metadata(Map.of())
            .complianceTierAtTime(tierOf(donorInfo))
            .fecCompliant(true)
            .auditTrail(auditTrail != null ? auditTrail : AuditTrail.EMPTY)
            .build();

        return Celebration.builder()
            .id(id)
            .donorId(donorId)
            .politicianId(politicianId)
            .billId(billId)
            .state(state)
            .donationAmount(donationAmount)
            .tipAmount(tipAmount)
            .fee(fee)
            .donorInfo(donorInfo)
            .currentStatus(CelebrationStatus.ACTIVE)
            .statusLedger(List.of(creation))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Applies a transition and appends exactly one ledger entry.
     *
     * @return New Celebration instance in the target status
     * @throws InvalidTransitionException if the table does not allow the transition
     */
    public Celebration transition(StatusChangeRequest request, Instant now) {
        Objects.requireNonNull(request, "request");
        CelebrationStatusMachine.validate(currentStatus, request.getTargetStatus());

        StatusActor actor = request.getActor() != null ? request.getActor() : StatusActor.system("System");
        StatusLedgerEntry entry = StatusLedgerEntry.builder()
            .statusChangeId(UUID.randomUUID())
            .celebrationId(id)
            .sequenceNumber(nextSequenceNumber())
            .previousStatus(currentStatus)
            .newStatus(request.getTargetStatus())
            .changedAt(now)
            .reason(request.getReason())
            .triggeredBy(actor.getType())
            .triggeredById(actor.getId())
            .triggeredByName(actor.getName())
            .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
            .complianceTierAtTime(tierOf(donorInfo))
            .fecCompliant(true)
            .auditTrail(actor.getAuditTrail() != null ? actor.getAuditTrail() : AuditTrail.EMPTY)
            .build();

        List<StatusLedgerEntry> ledger = new ArrayList<>(statusLedgerOrEmpty());
        ledger.add(entry);

        CelebrationBuilder next = toBuilder()
            .currentStatus(request.getTargetStatus())
            .statusLedger(Collections.unmodifiableList(ledger))
            .updatedAt(now);
        if (request.getTargetStatus() == CelebrationStatus.DEFUNCT) {
            next.defunctDate(now).defunctReason(request.getReason());
        }
        return next.build();
    }

    /**
     * The ledger entry written by the most recent transition.
     */
    public StatusLedgerEntry latestEntry() {
        List<StatusLedgerEntry> ledger = statusLedgerOrEmpty();
        return ledger.isEmpty() ? null : ledger.get(ledger.size() - 1);
    }

    public boolean isResolved() {
        return currentStatus == CelebrationStatus.RESOLVED;
    }

    public boolean isPaused() {
        return currentStatus == CelebrationStatus.PAUSED;
    }

    public boolean isDefunct() {
        return currentStatus == CelebrationStatus.DEFUNCT;
    }

    private int nextSequenceNumber() {
        StatusLedgerEntry latest = latestEntry();
        return latest == null ? 1 : latest.getSequenceNumber() + 1;
    }

    private List<StatusLedgerEntry> statusLedgerOrEmpty() {
        return statusLedger != null ? statusLedger : List.of();
    }

    private static String tierOf(DonorInfoSnapshot donorInfo) {
        return donorInfo != null && donorInfo.getCompliance() != null ? donorInfo.getCompliance() : "unverified";
    }
}
