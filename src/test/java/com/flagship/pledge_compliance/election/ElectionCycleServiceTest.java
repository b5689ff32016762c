package com.flagship.pledge_compliance.election;

import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ElectionCycleServiceTest {

    private static final ZoneId EASTERN = ZoneId.of("America/New_York");

    @Mock
    private ElectionDateProvider dateProvider;
    @Mock
    private PoliticianDirectory politicianDirectory;

    private SimpleMeterRegistry registry;
    private ElectionCycleService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-07-01T16:00:00Z"), ZoneOffset.UTC);
        service = new ElectionCycleService(dateProvider, politicianDirectory, new ElectionCycleCalculator(EASTERN),
                new ComplianceMetrics(registry), clock, EASTERN);
    }

    @Test
    @DisplayName("Published dates are used as-is")
    void publishedDates() {
        when(dateProvider.getElectionDates("TX")).thenReturn(Optional.of(ElectionDates.authoritative(
                "TX", LocalDate.of(2026, 3, 3), LocalDate.of(2026, 11, 3), null, null)));

        ElectionCycle cycle = service.currentCycle("TX");

        assertThat(cycle.getSource()).isEqualTo(ElectionDateSource.AUTHORITATIVE);
        assertThat(cycle.getCurrentElectionType()).isEqualTo(ElectionType.PRIMARY);
    }

    @Test
    @DisplayName("Lookup failure degrades to fallback dates instead of failing")
    void lookupFailure() {
        when(dateProvider.getElectionDates("TX")).thenThrow(new IllegalStateException("connection refused"));

        ElectionCycle cycle = service.currentCycle("TX");

        assertThat(cycle.getSource()).isEqualTo(ElectionDateSource.FALLBACK);
        assertThat(cycle.getCycleStartDate()).isEqualTo(Instant.parse("2026-06-01T04:00:00Z"));
    }

    @Test
    @DisplayName("Missing or empty rows degrade to fallback dates")
    void missingDates() {
        when(dateProvider.getElectionDates("WY")).thenReturn(Optional.empty());
        when(dateProvider.getElectionDates("VT")).thenReturn(Optional.of(
                ElectionDates.authoritative("VT", null, null, null, null)));

        assertThat(service.resolveDates("WY", Instant.parse("2026-07-01T16:00:00Z")).isFallback()).isTrue();
        assertThat(service.resolveDates("VT", Instant.parse("2026-07-01T16:00:00Z")).isFallback()).isTrue();
    }

    @Test
    @DisplayName("A recipient's cycle follows the state on record")
    void recipientCycle() {
        when(politicianDirectory.findState("pol-tx")).thenReturn(Optional.of("TX"));
        when(dateProvider.getElectionDates("TX")).thenReturn(Optional.of(ElectionDates.authoritative(
                "TX", LocalDate.of(2026, 3, 3), LocalDate.of(2026, 11, 3), null, null)));

        ElectionCycle cycle = service.cycleForRecipient("pol-tx");

        assertThat(cycle.getState()).isEqualTo("TX");
        assertThat(cycle.getCycleStartDate()).isEqualTo(Instant.parse("2026-03-03T05:00:00Z"));
    }

    @Test
    @DisplayName("Unknown recipient or failed lookup degrades to the fallback cycle")
    void unknownRecipient() {
        when(politicianDirectory.findState("pol-unknown")).thenReturn(Optional.empty());
        when(politicianDirectory.findState("pol-broken")).thenThrow(new IllegalStateException("timeout"));

        assertThat(service.cycleForRecipient("pol-unknown").getSource()).isEqualTo(ElectionDateSource.FALLBACK);
        assertThat(service.recipientState("pol-broken")).isNull();
        assertThat(registry.counter("compliance.degraded_data", "kind", "politician_state").count()).isEqualTo(2.0);
    }
}
