package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCycle;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating one attempted donation.
 */
@Value
@Builder
public class ComplianceDecision {
    boolean compliant;
    ComplianceTier tier;
    BigDecimal attemptedAmount;
    DonationTotals totals;
    BigDecimal remainingLimit;
    @Singular
    List<LimitInfo> violations;
    ElectionCycle electionCycle;
    ValidationMode mode;

    /**
     * The highest-priority violation, if any.
     */
    public Optional<LimitInfo> firstViolation() {
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }
}
