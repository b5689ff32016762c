package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCycle;
import com.flagship.pledge_compliance.election.ElectionDateSource;
import com.flagship.pledge_compliance.election.ElectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LimitEngineTest {

    private static final Instant NOW = Instant.parse("2026-07-01T16:00:00Z");

    private final AnnualResetBoundary annualReset = new AnnualResetBoundary(ZoneId.of("America/New_York"));
    private final LimitEngine engine = new LimitEngine(TierRuleTable.defaults(), annualReset);

    private final ElectionCycle cycle = ElectionCycle.builder()
            .state("TX")
            .currentElectionType(ElectionType.PRIMARY)
            .inElectionCycle(true)
            .cycleStartDate(Instant.parse("2026-03-03T05:00:00Z"))
            .cycleEndDate(Instant.parse("2026-11-03T04:59:59.999Z"))
            .nextElectionDate(Instant.parse("2026-11-03T05:00:00Z"))
            .source(ElectionDateSource.AUTHORITATIVE)
            .build();

    @Test
    @DisplayName("Unverified: $180 this year plus $30 breaks the $200 annual cap")
    void unverifiedAnnualCapExceeded() {
        List<PledgeRecord> history = List.of(
                pledge("50", "pol-a", NOW.minus(30, ChronoUnit.DAYS)),
                pledge("50", "pol-b", NOW.minus(20, ChronoUnit.DAYS)),
                pledge("50", "pol-c", NOW.minus(10, ChronoUnit.DAYS)),
                pledge("30", "pol-d", NOW.minus(5, ChronoUnit.DAYS)));

        ComplianceDecision decision = engine.validateDonation(
                ComplianceTier.UNVERIFIED, new BigDecimal("30"), "pol-e", history, cycle, NOW);

        assertThat(decision.isCompliant()).isFalse();
        LimitInfo violation = decision.firstViolation().orElseThrow();
        assertThat(violation.getLimitType()).isEqualTo(LimitType.ANNUAL_CAP);
        assertThat(violation.getAmount()).isEqualByComparingTo("200");
        assertThat(violation.getMessage()).contains("$200");
    }

    @Test
    @DisplayName("Unverified: $180 this year plus $15 is approved, leaving $5")
    void unverifiedWithinCap() {
        List<PledgeRecord> history = List.of(
                pledge("50", "pol-a", NOW.minus(30, ChronoUnit.DAYS)),
                pledge("50", "pol-b", NOW.minus(20, ChronoUnit.DAYS)),
                pledge("50", "pol-c", NOW.minus(10, ChronoUnit.DAYS)),
                pledge("30", "pol-d", NOW.minus(5, ChronoUnit.DAYS)));

        ComplianceDecision decision = engine.validateDonation(
                ComplianceTier.UNVERIFIED, new BigDecimal("15"), "pol-e", history, cycle, NOW);

        assertThat(decision.isCompliant()).isTrue();
        assertThat(decision.getMode()).isEqualTo(ValidationMode.ENHANCED);
        DonationTotals afterwards = new DonationTotals(new BigDecimal("195"), BigDecimal.ZERO);
        assertThat(engine.remainingLimit(ComplianceTier.UNVERIFIED, afterwards)).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("Per-donation limit is reported before aggregate caps")
    void perDonationFirst() {
        List<PledgeRecord> history = List.of(pledge("190", "pol-a", NOW.minus(1, ChronoUnit.DAYS)));

        ComplianceDecision decision = engine.validateDonation(
                ComplianceTier.UNVERIFIED, new BigDecimal("60"), "pol-a", history, cycle, NOW);

        assertThat(decision.getViolations()).extracting(LimitInfo::getLimitType)
                .containsExactly(LimitType.PER_DONATION, LimitType.ANNUAL_CAP);
    }

    @Test
    @DisplayName("Verified: per-election limit is per recipient")
    void verifiedPerRecipient() {
        List<PledgeRecord> history = List.of(pledge("3000", "pol-a", NOW.minus(10, ChronoUnit.DAYS)));

        ComplianceDecision toB = engine.validateDonation(
                ComplianceTier.VERIFIED, new BigDecimal("3500"), "pol-b", history, cycle, NOW);
        ComplianceDecision toA = engine.validateDonation(
                ComplianceTier.VERIFIED, new BigDecimal("501"), "pol-a", history, cycle, NOW);

        assertThat(toB.isCompliant()).isTrue();
        assertThat(toA.isCompliant()).isFalse();
        assertThat(toA.firstViolation().orElseThrow().getLimitType()).isEqualTo(LimitType.PER_ELECTION);
        assertThat(toA.getRemainingLimit()).isEqualByComparingTo("500");
    }

    @Test
    @DisplayName("Verified: staged $3,200 for a recipient with $3,000 given is clamped to $500")
    void clampStaged() {
        List<PledgeRecord> history = List.of(pledge("3000", "pol-a", NOW.minus(10, ChronoUnit.DAYS)));
        DonationTotals totals = engine.aggregate(history, "pol-a", cycle, NOW);

        BigDecimal remaining = engine.remainingLimit(ComplianceTier.VERIFIED, totals);

        assertThat(engine.clampStagedDonation(new BigDecimal("3200"), remaining)).isEqualByComparingTo("500");
        assertThat(engine.clampStagedDonation(new BigDecimal("200"), remaining)).isEqualByComparingTo("200");
        assertThat(engine.clampStagedDonation(null, remaining)).isNull();
    }

    @Test
    @DisplayName("wouldExceedLimits agrees with getLimitInfo")
    void predicateAgreesWithInfo() {
        for (ComplianceTier tier : ComplianceTier.values()) {
            for (String amount : List.of("1", "20", "50", "50.01", "150", "3500", "3500.01")) {
                for (String annual : List.of("0", "150", "199.99", "200")) {
                    BigDecimal a = new BigDecimal(amount);
                    BigDecimal t = new BigDecimal(annual);
                    assertThat(engine.wouldExceedLimits(tier, a, t, t))
                            .as("%s %s %s", tier, amount, annual)
                            .isEqualTo(engine.getLimitInfo(tier, a, t, t).isPresent());
                }
            }
        }
    }

    @Test
    @DisplayName("Remaining limit never exceeds the per-donation limit")
    void remainingCappedByPerDonation() {
        assertThat(engine.remainingLimit(ComplianceTier.UNVERIFIED, DonationTotals.ZERO)).isEqualByComparingTo("50");
        assertThat(engine.remainingLimit(ComplianceTier.UNVERIFIED,
                new DonationTotals(new BigDecimal("250"), BigDecimal.ZERO))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Defunct and paused pledges do not count; prior-year pledges reset")
    void excludedPledges() {
        List<PledgeRecord> history = List.of(
                pledge("50", "pol-a", NOW.minus(1, ChronoUnit.DAYS), true, false, false),
                pledge("50", "pol-a", NOW.minus(1, ChronoUnit.DAYS), false, true, false),
                pledge("50", "pol-a", Instant.parse("2025-12-31T12:00:00Z")),
                pledge("25", "pol-a", NOW.minus(1, ChronoUnit.DAYS), false, false, true));

        DonationTotals totals = engine.aggregate(history, "pol-a", cycle, NOW);

        assertThat(totals.getAnnualTotal()).isEqualByComparingTo("25");
    }

    @Test
    @DisplayName("Annual reset happens at Eastern midnight")
    void easternReset() {
        Instant justAfterEasternMidnight = Instant.parse("2026-01-01T05:00:00Z");
        List<PledgeRecord> history = List.of(
                pledge("50", "pol-a", Instant.parse("2026-01-01T04:59:59Z")),
                pledge("40", "pol-a", Instant.parse("2026-01-01T05:00:00Z")));

        DonationTotals totals = engine.aggregate(history, "pol-a", cycle, justAfterEasternMidnight);

        assertThat(totals.getAnnualTotal()).isEqualByComparingTo("40");
    }

    @Test
    @DisplayName("A stale cycle window is stretched to now")
    void staleWindowStretched() {
        Instant afterWindow = Instant.parse("2026-12-01T12:00:00Z");
        List<PledgeRecord> history = List.of(pledge("1000", "pol-a", Instant.parse("2026-11-20T12:00:00Z")));

        DonationTotals totals = engine.aggregate(history, "pol-a", cycle, afterWindow);

        assertThat(totals.getElectionTotal()).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("Suggested amounts are capped to the remaining limit and deduplicated")
    void suggestions() {
        assertThat(engine.suggestedAmounts(ComplianceTier.UNVERIFIED, new BigDecimal("20")))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("2"), new BigDecimal("5"), new BigDecimal("10"), new BigDecimal("20"));
        assertThat(engine.suggestedAmounts(ComplianceTier.UNVERIFIED, BigDecimal.ZERO)).isEmpty();
    }

    @Test
    @DisplayName("Summary for an unverified donor resets at the calendar year")
    void summary() {
        LimitSummary summary = engine.summarize(ComplianceTier.UNVERIFIED, DonationTotals.ZERO, cycle, NOW);

        assertThat(summary.getResetType()).isEqualTo(ResetType.ANNUAL);
        assertThat(summary.getEffectiveLimit()).isEqualByComparingTo("200");
        assertThat(summary.getRemainingLimit()).isEqualByComparingTo("50");
        assertThat(summary.getNextResetDate()).isEqualTo(Instant.parse("2027-01-01T05:00:00Z"));
    }

    @Test
    @DisplayName("Missing amount is rejected")
    void missingAmount() {
        assertThatThrownBy(() -> engine.getLimitInfo(ComplianceTier.VERIFIED, null, BigDecimal.ZERO, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static PledgeRecord pledge(String amount, String recipient, Instant createdAt) {
        return pledge(amount, recipient, createdAt, false, false, false);
    }

    private static PledgeRecord pledge(String amount, String recipient, Instant createdAt,
                                       boolean defunct, boolean paused, boolean resolved) {
        return PledgeRecord.builder()
                .celebrationId(UUID.randomUUID())
                .donationAmount(new BigDecimal(amount))
                .tipAmount(BigDecimal.ZERO)
                .recipientId(recipient)
                .createdAt(createdAt)
                .defunct(defunct)
                .paused(paused)
                .resolved(resolved)
                .build();
    }
}
