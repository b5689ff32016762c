package com.flagship.pledge_compliance.pac;

import com.flagship.pledge_compliance.compliance.AnnualResetBoundary;
import com.flagship.pledge_compliance.compliance.PledgeRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Annual cap on optional PAC tips, shared across all recipients and independent of tier.
 *
 * Rules:
 * - Only tips on pledges created this calendar year (compliance zone) count
 * - Resolved, defunct and paused pledges do not count
 * - A tip that makes the total reach the cap sets the donor's sticky
 *   tipLimitReached flag; a tip that goes past the cap is truncated to zero
 */
@Component
public class PacLimitTracker {

    private final BigDecimal pacLimit;
    private final AnnualResetBoundary annualReset;

    public PacLimitTracker(@Value("${compliance.pac.annual-limit:5000}") BigDecimal pacLimit,
                           AnnualResetBoundary annualReset) {
        this.pacLimit = pacLimit;
        this.annualReset = annualReset;
    }

    public BigDecimal getPacLimit() {
        return pacLimit;
    }

    /**
     * Sums this year's counted tips.
     */
    public BigDecimal currentTotal(List<PledgeRecord> history, Instant now) {
        Instant yearStart = annualReset.currentPeriodStart(now);
        return history.stream()
                .filter(PledgeRecord::countsTowardPacLimit)
                .filter(p -> p.getCreatedAt() != null && !p.getCreatedAt().isBefore(yearStart))
                .map(PledgeRecord::getTipAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Summarizes a donor's PAC usage.
     *
     * @param history Donor's pledges
     * @param now Evaluation instant
     * @param tipLimitReached The donor's stored sticky flag
     */
    public PacLimitSummary summarize(List<PledgeRecord> history, Instant now, boolean tipLimitReached) {
        BigDecimal total = currentTotal(history, now);
        return PacLimitSummary.builder()
                .pacLimit(pacLimit)
                .currentPACTotal(total)
                .remainingPACLimit(pacLimit.subtract(total).max(BigDecimal.ZERO))
                .pacLimitExceeded(total.compareTo(pacLimit) >= 0)
                .compliant(total.compareTo(pacLimit) <= 0)
                .tipLimitReached(tipLimitReached)
                .build();
    }

    /**
     * Applies the cap to a requested tip.
     *
     * @param currentTotal Tips already counted this year
     * @param requestedTip Tip on the pledge being created
     * @return The tip to record and whether the donor's flag must be set
     */
    public TipDecision evaluateTip(BigDecimal currentTotal, BigDecimal requestedTip) {
        BigDecimal tip = requestedTip != null ? requestedTip : BigDecimal.ZERO;
        if (tip.signum() < 0) {
            throw new IllegalArgumentException("Tip amount cannot be negative");
        }
        if (tip.signum() == 0) {
            return new TipDecision(tip, tip, currentTotal, false, false);
        }

        BigDecimal newTotal = currentTotal.add(tip);
        boolean reached = newTotal.compareTo(pacLimit) >= 0;
        boolean exceeded = newTotal.compareTo(pacLimit) > 0;
        BigDecimal accepted = exceeded ? BigDecimal.ZERO : tip;
        return new TipDecision(tip, accepted, currentTotal.add(accepted), reached, exceeded);
    }
}
