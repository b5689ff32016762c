package com.flagship.pledge_compliance.election;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The election-cycle window in effect at a given instant.
 *
 * Verified-tier per-election totals only count pledges created inside
 * {@code [cycleStartDate, cycleEndDate]}.
 */
@Value
@Builder
public class ElectionCycle {
    String state;
    ElectionType currentElectionType;
    boolean inElectionCycle;
    Instant cycleStartDate;
    Instant cycleEndDate;
    Instant nextElectionDate;
    ElectionDateSource source;

    public boolean contains(Instant instant) {
        return !instant.isBefore(cycleStartDate) && !instant.isAfter(cycleEndDate);
    }
}
