package com.flagship.pledge_compliance.compliance;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Limits that apply to one compliance tier.
 *
 * Aggregate caps are optional: a tier either caps the total across all
 * recipients per year, caps the total per recipient per election, or both.
 */
@Value
@Builder
public class TierRule {
    ComplianceTier tier;
    BigDecimal perDonationLimit;
    String perDonationScope;
    BigDecimal annualCap;
    BigDecimal perElectionLimit;
    ResetType resetType;
    String description;
    @Singular
    List<BigDecimal> suggestedAmounts;

    public boolean hasAnnualCap() {
        return annualCap != null;
    }

    public boolean hasPerElectionLimit() {
        return perElectionLimit != null;
    }

    /**
     * The aggregate cap shown to donors as their effective limit.
     */
    public BigDecimal aggregateLimit() {
        if (resetType == ResetType.ELECTION_CYCLE && hasPerElectionLimit()) {
            return perElectionLimit;
        }
        return hasAnnualCap() ? annualCap : perElectionLimit;
    }
}
