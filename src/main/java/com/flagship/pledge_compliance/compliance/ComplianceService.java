package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCycle;
import com.flagship.pledge_compliance.election.ElectionCycleService;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Server-side gate for donation limits.
 *
 * Runs the election-cycle aware check and, if it throws, the legacy rule set.
 * The fallback is logged and counted so the two rule sets can be audited
 * against each other. Every pledge is validated here regardless of what a
 * client computed. The election calendar is chosen by the recipient's state
 * on record, never by a caller-supplied state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceService {

    private final LimitEngine limitEngine;
    private final LegacyLimitValidator legacyValidator;
    private final ElectionCycleService electionCycleService;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    /**
     * Validates an attempted donation.
     *
     * @param tier Donor's effective tier
     * @param amount Attempted donation
     * @param recipientId Selected recipient
     * @param history Donor's pledges
     * @return The decision, from the enhanced rules or, on failure, the legacy ones
     */
    public ComplianceDecision checkDonation(ComplianceTier tier, BigDecimal amount, String recipientId,
                                            List<PledgeRecord> history) {
        Instant now = clock.instant();
        ComplianceDecision evaluated;
        try {
            ElectionCycle cycle = electionCycleService.cycleForRecipient(recipientId);
            evaluated = limitEngine.validateDonation(tier, amount, recipientId, history, cycle, now);
        } catch (RuntimeException e) {
            log.warn("Enhanced compliance check failed for recipient {}, falling back to legacy validation: {}",
                    recipientId, e.getMessage());
            metrics.recordLegacyFallback();
            evaluated = legacyValidator.validate(tier, amount, recipientId, history, now);
        }

        final ComplianceDecision decision = evaluated;
        if (!decision.isCompliant()) {
            decision.firstViolation().ifPresent(violation -> {
                log.info("Donation of {} rejected: limitType={}, tier={}, mode={}",
                        amount, violation.getLimitType().getValue(), tier.getValue(), decision.getMode());
                metrics.recordComplianceRejection(violation.getLimitType().getValue());
            });
        }
        return decision;
    }

    /**
     * Builds the limit summary for a donor and recipient.
     */
    public LimitSummary limitSummary(ComplianceTier tier, String recipientId, List<PledgeRecord> history) {
        Instant now = clock.instant();
        ElectionCycle cycle = electionCycleService.cycleForRecipient(recipientId);
        DonationTotals totals = limitEngine.aggregate(history, recipientId, cycle, now);
        return limitEngine.summarize(tier, totals, cycle, now);
    }

    /**
     * Advisory check for a client about to stage a donation. Pledge creation
     * validates again through {@link #checkDonation}.
     *
     * @return The limit the amount would break, or empty if it fits
     */
    public Optional<LimitInfo> previewDonation(ComplianceTier tier, BigDecimal amount, String recipientId,
                                               List<PledgeRecord> history) {
        Instant now = clock.instant();
        ElectionCycle cycle = electionCycleService.cycleForRecipient(recipientId);
        DonationTotals totals = limitEngine.aggregate(history, recipientId, cycle, now);
        return limitEngine.getLimitInfo(tier, amount, totals.getAnnualTotal(), totals.getElectionTotal());
    }
}
