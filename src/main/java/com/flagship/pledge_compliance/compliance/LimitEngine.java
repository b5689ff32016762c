package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCycle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contribution limit rules.
 *
 * Key principles:
 * - Limits come from the {@link TierRuleTable}; nothing here branches on a tier name
 * - The per-donation limit is checked first, then each aggregate cap the tier defines
 * - A value computed by a client is advisory only; pledge creation always calls
 *   {@link #validateDonation} again on the server
 *
 * All methods are pure functions of their arguments. Persistence and locking
 * belong to the caller.
 */
@Component
@RequiredArgsConstructor
public class LimitEngine {

    private final TierRuleTable tierRules;
    private final AnnualResetBoundary annualReset;

    public TierRule ruleFor(ComplianceTier tier) {
        return tierRules.ruleFor(tier);
    }

    /**
     * Checks whether an attempted amount breaks any limit of the tier.
     *
     * Always agrees with {@link #getLimitInfo}: true exactly when that returns a value.
     */
    public boolean wouldExceedLimits(ComplianceTier tier, BigDecimal amount,
                                     BigDecimal currentAnnualTotal, BigDecimal currentElectionTotal) {
        return getLimitInfo(tier, amount, currentAnnualTotal, currentElectionTotal).isPresent();
    }

    /**
     * Describes the highest-priority limit an attempted amount would break.
     *
     * @param tier Donor's effective tier
     * @param amount Attempted donation
     * @param currentAnnualTotal Donated this calendar year across all recipients
     * @param currentElectionTotal Donated to the selected recipient this election
     * @return The violated limit, or empty if the amount is within every limit
     */
    public Optional<LimitInfo> getLimitInfo(ComplianceTier tier, BigDecimal amount,
                                            BigDecimal currentAnnualTotal, BigDecimal currentElectionTotal) {
        List<LimitInfo> violations = collectViolations(ruleFor(tier), amount,
                nullToZero(currentAnnualTotal), nullToZero(currentElectionTotal));
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }

    /**
     * Most the donor can give in the next single donation:
     * {@code min(perDonationLimit, aggregateCap - aggregateTotal)}, floored at zero.
     */
    public BigDecimal remainingLimit(ComplianceTier tier, DonationTotals totals) {
        TierRule rule = ruleFor(tier);
        BigDecimal remaining = rule.getPerDonationLimit();
        if (rule.hasAnnualCap()) {
            remaining = remaining.min(rule.getAnnualCap().subtract(totals.getAnnualTotal()));
        }
        if (rule.hasPerElectionLimit()) {
            remaining = remaining.min(rule.getPerElectionLimit().subtract(totals.getElectionTotal()));
        }
        return remaining.max(BigDecimal.ZERO);
    }

    /**
     * Clamps a staged donation to the remaining limit of the selected recipient.
     * A staged amount is derived from the limit; it is never left above it.
     */
    public BigDecimal clampStagedDonation(BigDecimal stagedAmount, BigDecimal remainingLimit) {
        if (stagedAmount == null) {
            return null;
        }
        return stagedAmount.min(remainingLimit).max(BigDecimal.ZERO);
    }

    /**
     * Tier's suggested amounts, each capped to the remaining limit. Entries that
     * end up at zero or below are dropped and duplicates collapse.
     */
    public List<BigDecimal> suggestedAmounts(ComplianceTier tier, BigDecimal remainingLimit) {
        List<BigDecimal> suggestions = new ArrayList<>();
        for (BigDecimal amount : ruleFor(tier).getSuggestedAmounts()) {
            BigDecimal capped = amount.min(remainingLimit);
            if (capped.signum() > 0 && suggestions.stream().noneMatch(s -> s.compareTo(capped) == 0)) {
                suggestions.add(capped);
            }
        }
        return suggestions;
    }

    /**
     * Aggregates a donor's history for one recipient.
     *
     * The annual total covers the current calendar year in the compliance zone. The
     * election total covers the cycle window; when "now" already lies past the end of
     * the window the window is stretched to "now" so the pledge being evaluated can
     * never fall outside its own aggregation.
     */
    public DonationTotals aggregate(List<PledgeRecord> history, String recipientId,
                                    ElectionCycle cycle, Instant now) {
        Instant windowEnd = cycle.getCycleEndDate().isBefore(now) ? now : cycle.getCycleEndDate();
        return DonationTotals.from(history, recipientId,
                annualReset.currentPeriodStart(now), cycle.getCycleStartDate(), windowEnd);
    }

    /**
     * Validates an attempted donation against the donor's history.
     *
     * @param tier Donor's effective tier
     * @param amount Attempted donation
     * @param recipientId Selected recipient
     * @param history Donor's pledges
     * @param cycle Election cycle of the recipient's state
     * @param now Evaluation instant
     * @return Decision listing every violated limit in priority order
     */
    public ComplianceDecision validateDonation(ComplianceTier tier, BigDecimal amount, String recipientId,
                                               List<PledgeRecord> history, ElectionCycle cycle, Instant now) {
        DonationTotals totals = aggregate(history, recipientId, cycle, now);
        return decide(tier, amount, totals, cycle, ValidationMode.ENHANCED);
    }

    /**
     * Builds the client summary of a donor's limits.
     */
    public LimitSummary summarize(ComplianceTier tier, DonationTotals totals, ElectionCycle cycle, Instant now) {
        TierRule rule = ruleFor(tier);
        LimitSummary.LimitSummaryBuilder summary = LimitSummary.builder()
                .complianceTier(rule.getTier())
                .resetType(rule.getResetType())
                .effectiveLimit(rule.aggregateLimit())
                .perDonationLimit(rule.getPerDonationLimit())
                .remainingLimit(remainingLimit(tier, totals));

        if (rule.getResetType() == ResetType.ELECTION_CYCLE && cycle != null) {
            summary.resetDate(cycle.getCycleStartDate())
                   .nextResetDate(cycle.getCycleEndDate().plusMillis(1));
        } else {
            summary.resetDate(annualReset.currentPeriodStart(now))
                   .nextResetDate(annualReset.nextReset(now));
        }
        return summary.build();
    }

    ComplianceDecision decide(ComplianceTier tier, BigDecimal amount, DonationTotals totals,
                              ElectionCycle cycle, ValidationMode mode) {
        TierRule rule = ruleFor(tier);
        List<LimitInfo> violations = collectViolations(rule, amount,
                totals.getAnnualTotal(), totals.getElectionTotal());
        return ComplianceDecision.builder()
                .compliant(violations.isEmpty())
                .tier(rule.getTier())
                .attemptedAmount(amount)
                .totals(totals)
                .remainingLimit(remainingLimit(rule.getTier(), totals))
                .violations(violations)
                .electionCycle(cycle)
                .mode(mode)
                .build();
    }

    private List<LimitInfo> collectViolations(TierRule rule, BigDecimal amount,
                                              BigDecimal annualTotal, BigDecimal electionTotal) {
        if (amount == null) {
            throw new IllegalArgumentException("Donation amount is required");
        }
        List<LimitInfo> violations = new ArrayList<>();

        if (amount.compareTo(rule.getPerDonationLimit()) > 0) {
            violations.add(LimitInfo.builder()
                    .limitType(LimitType.PER_DONATION)
                    .amount(rule.getPerDonationLimit())
                    .scope(rule.getPerDonationScope())
                    .message(String.format("You cannot donate more than %s in a single transaction.",
                            dollars(rule.getPerDonationLimit())))
                    .build());
        }
        if (rule.hasAnnualCap() && annualTotal.add(amount).compareTo(rule.getAnnualCap()) > 0) {
            violations.add(LimitInfo.builder()
                    .limitType(LimitType.ANNUAL_CAP)
                    .amount(rule.getAnnualCap())
                    .scope("total annual cap")
                    .message(String.format("This donation would exceed your %s annual cap across all candidates.",
                            dollars(rule.getAnnualCap())))
                    .build());
        }
        if (rule.hasPerElectionLimit() && electionTotal.add(amount).compareTo(rule.getPerElectionLimit()) > 0) {
            violations.add(LimitInfo.builder()
                    .limitType(LimitType.PER_ELECTION)
                    .amount(rule.getPerElectionLimit())
                    .scope("per candidate per election")
                    .message(String.format("This donation would exceed your %s limit for this candidate in this election.",
                            dollars(rule.getPerElectionLimit())))
                    .build());
        }
        return violations;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    static String dollars(BigDecimal amount) {
        return "$" + amount.stripTrailingZeros().toPlainString();
    }
}
