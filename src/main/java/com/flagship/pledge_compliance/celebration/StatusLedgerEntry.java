package com.flagship.pledge_compliance.celebration;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable record in a celebration's status ledger.
 *
 * {@code previousStatus} is null only for the creation entry ("none" to active).
 */
@Value
@Builder
public class StatusLedgerEntry {
    UUID statusChangeId;
    UUID celebrationId;
    int sequenceNumber;
    CelebrationStatus previousStatus;
    CelebrationStatus newStatus;
    Instant changedAt;
    String reason;
    TriggerType triggeredBy;
    String triggeredById;
    String triggeredByName;
    Map<String, Object> metadata;
    String complianceTierAtTime;
    boolean fecCompliant;
    AuditTrail auditTrail;

    public boolean isCreationEntry() {
        return previousStatus == null;
    }
}
