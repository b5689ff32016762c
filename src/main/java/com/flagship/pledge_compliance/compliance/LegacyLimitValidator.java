package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Election-agnostic limit rules, used when the election-cycle aware check fails.
 *
 * Per-recipient totals are taken over the two-year campaign window (January 1
 * of the odd year through December 31 of the following even year) instead of
 * the state's election cycle. Needs no election-date lookup, so it cannot fail
 * for the reasons the enhanced check can.
 */
@Component
@RequiredArgsConstructor
public class LegacyLimitValidator {

    private final LimitEngine limitEngine;
    private final AnnualResetBoundary annualReset;

    /**
     * @param tier Donor's effective tier
     * @param amount Attempted donation
     * @param recipientId Selected recipient
     * @param history Donor's pledges
     * @param now Evaluation instant
     * @return Decision marked {@link ValidationMode#LEGACY}
     */
    public ComplianceDecision validate(ComplianceTier tier, BigDecimal amount, String recipientId,
                                       List<PledgeRecord> history, Instant now) {
        ZoneId zone = annualReset.getZone();
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant windowStart = ElectionCalendar.campaignWindowStart(today).atStartOfDay(zone).toInstant();
        Instant windowEnd = ElectionCalendar.campaignWindowEnd(today).plusDays(1)
                .atStartOfDay(zone).toInstant().minusMillis(1);

        DonationTotals totals = DonationTotals.from(history, recipientId,
                annualReset.currentPeriodStart(now), windowStart, windowEnd);
        return limitEngine.decide(tier, amount, totals, null, ValidationMode.LEGACY);
    }
}
