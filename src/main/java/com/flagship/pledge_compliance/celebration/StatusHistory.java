package com.flagship.pledge_compliance.celebration;

import lombok.Value;

import java.util.List;

/**
 * Newest-first slice of a celebration's ledger.
 */
@Value
public class StatusHistory {
    long totalChanges;
    List<StatusLedgerEntry> recentChanges;
    CelebrationStatus currentStatus;
    StatusDuration statusDuration;
}
