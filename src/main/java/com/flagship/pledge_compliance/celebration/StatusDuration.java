package com.flagship.pledge_compliance.celebration;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Whole days in the current status and since creation, floored.
 */
@Value
public class StatusDuration {
    long currentStatusDurationDays;
    long totalLifetimeDays;
    Instant lastChangeDate;

    public static StatusDuration of(Celebration celebration, Instant now) {
        StatusLedgerEntry latest = celebration.latestEntry();
        Instant lastChange = latest != null ? latest.getChangedAt() : celebration.getCreatedAt();
        return new StatusDuration(
            wholeDays(lastChange, now),
            wholeDays(celebration.getCreatedAt(), now),
            lastChange
        );
    }

    private static long wholeDays(Instant from, Instant to) {
        return Math.max(0, Duration.between(from, to).toDays());
    }
}
