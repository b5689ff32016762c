package com.flagship.pledge_compliance.compliance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a pledge that limit aggregation needs.
 */
@Value
@Builder
public class PledgeRecord {
    UUID celebrationId;
    BigDecimal donationAmount;
    BigDecimal tipAmount;
    String recipientId;
    Instant createdAt;
    boolean defunct;
    boolean paused;
    boolean resolved;

    /**
     * Defunct and paused pledges do not count against donation limits.
     */
    public boolean countsTowardDonationLimits() {
        return !defunct && !paused;
    }

    /**
     * Tips on resolved, defunct or paused pledges do not count against the PAC limit.
     */
    public boolean countsTowardPacLimit() {
        return !defunct && !paused && !resolved;
    }
}
