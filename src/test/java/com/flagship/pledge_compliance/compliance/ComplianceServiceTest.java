package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.election.ElectionCycleCalculator;
import com.flagship.pledge_compliance.election.ElectionCycleService;
import com.flagship.pledge_compliance.election.ElectionDateProvider;
import com.flagship.pledge_compliance.election.ElectionDates;
import com.flagship.pledge_compliance.election.PoliticianDirectory;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplianceServiceTest {

    private static final ZoneId EASTERN = ZoneId.of("America/New_York");

    @Mock
    private ElectionCycleService electionCycleService;
    @Mock
    private ElectionDateProvider dateProvider;
    @Mock
    private PoliticianDirectory politicianDirectory;

    private SimpleMeterRegistry registry;
    private ComplianceService service;

    @BeforeEach
    void setUp() {
        AnnualResetBoundary annualReset = new AnnualResetBoundary(EASTERN);
        LimitEngine engine = new LimitEngine(TierRuleTable.defaults(), annualReset);
        registry = new SimpleMeterRegistry();
        service = new ComplianceService(engine, new LegacyLimitValidator(engine, annualReset), electionCycleService,
                new ComplianceMetrics(registry), Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Enhanced check failure falls back to the legacy rules")
    void fallsBackToLegacy() {
        when(electionCycleService.cycleForRecipient("pol-a")).thenThrow(new IllegalStateException("calendar unavailable"));

        ComplianceDecision decision = service.checkDonation(
                ComplianceTier.UNVERIFIED, new BigDecimal("25"), "pol-a", List.of());

        assertThat(decision.isCompliant()).isTrue();
        assertThat(decision.getMode()).isEqualTo(ValidationMode.LEGACY);
        assertThat(registry.counter("compliance.legacy_fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Fallback still rejects over-limit donations")
    void fallbackStillRejects() {
        when(electionCycleService.cycleForRecipient("pol-a")).thenThrow(new IllegalStateException("calendar unavailable"));

        ComplianceDecision decision = service.checkDonation(
                ComplianceTier.UNVERIFIED, new BigDecimal("75"), "pol-a", List.of());

        assertThat(decision.isCompliant()).isFalse();
        assertThat(decision.firstViolation()).map(LimitInfo::getLimitType).contains(LimitType.PER_DONATION);
    }

    @Test
    @DisplayName("Per-election window is taken from the recipient's state on record")
    void electionWindowFollowsRecipientState() {
        Clock july = Clock.fixed(Instant.parse("2026-07-01T16:00:00Z"), ZoneOffset.UTC);
        AnnualResetBoundary annualReset = new AnnualResetBoundary(EASTERN);
        LimitEngine engine = new LimitEngine(TierRuleTable.defaults(), annualReset);
        ComplianceMetrics metrics = new ComplianceMetrics(registry);
        ElectionCycleService cycles = new ElectionCycleService(dateProvider, politicianDirectory,
                new ElectionCycleCalculator(EASTERN), metrics, july, EASTERN);
        ComplianceService checked = new ComplianceService(engine, new LegacyLimitValidator(engine, annualReset),
                cycles, metrics, july);

        when(politicianDirectory.findState("pol-tx")).thenReturn(Optional.of("TX"));
        when(dateProvider.getElectionDates("TX")).thenReturn(Optional.of(ElectionDates.authoritative(
                "TX", LocalDate.of(2026, 3, 3), LocalDate.of(2026, 11, 3), null, null)));
        // Given after the TX primary but before the generic June 1 fallback primary
        PledgeRecord april = PledgeRecord.builder()
                .celebrationId(UUID.randomUUID())
                .donationAmount(new BigDecimal("3500"))
                .tipAmount(BigDecimal.ZERO)
                .recipientId("pol-tx")
                .createdAt(Instant.parse("2026-04-15T16:00:00Z"))
                .build();

        ComplianceDecision decision = checked.checkDonation(
                ComplianceTier.VERIFIED, new BigDecimal("3500"), "pol-tx", List.of(april));

        assertThat(decision.isCompliant()).isFalse();
        assertThat(decision.firstViolation()).map(LimitInfo::getLimitType).contains(LimitType.PER_ELECTION);
        assertThat(decision.getElectionCycle().getState()).isEqualTo("TX");
    }
}
