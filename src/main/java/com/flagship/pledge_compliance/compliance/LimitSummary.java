package com.flagship.pledge_compliance.compliance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only projection of a donor's limits for a client.
 *
 * {@code remainingLimit} never exceeds {@code perDonationLimit}: it is the most
 * the donor can give in the next single donation.
 */
@Value
@Builder
public class LimitSummary {
    ComplianceTier complianceTier;
    ResetType resetType;
    Instant resetDate;
    BigDecimal effectiveLimit;
    BigDecimal perDonationLimit;
    BigDecimal remainingLimit;
    Instant nextResetDate;
}
