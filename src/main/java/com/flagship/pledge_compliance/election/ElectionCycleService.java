package com.flagship.pledge_compliance.election;

import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Resolves a state's election dates and computes its current cycle.
 *
 * Missing, empty or failing date lookups degrade to the generic fallback dates.
 * The degradation is logged and counted but never fails the request; the
 * returned cycle carries {@link ElectionDateSource#FALLBACK} so callers can tell.
 */
@Service
@Slf4j
public class ElectionCycleService {

    private final ElectionDateProvider dateProvider;
    private final PoliticianDirectory politicianDirectory;
    private final ElectionCycleCalculator calculator;
    private final ComplianceMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;

    public ElectionCycleService(ElectionDateProvider dateProvider,
                                PoliticianDirectory politicianDirectory,
                                ElectionCycleCalculator calculator,
                                ComplianceMetrics metrics,
                                Clock clock,
                                ZoneId complianceZone) {
        this.dateProvider = dateProvider;
        this.politicianDirectory = politicianDirectory;
        this.calculator = calculator;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = complianceZone;
    }

    /**
     * Computes the election cycle currently in effect for a state.
     *
     * @param state Two-letter state code, may be null
     * @return Current cycle, computed from fallback dates if necessary
     */
    public ElectionCycle currentCycle(String state) {
        Instant now = clock.instant();
        return calculator.calculate(resolveDates(state, now), now);
    }

    /**
     * Computes the cycle a pledge to this recipient is measured against. The
     * state comes from the recipient directory only.
     *
     * @param politicianId Recipient identifier
     * @return Current cycle of the recipient's state, or the fallback cycle if the state is unknown
     */
    public ElectionCycle cycleForRecipient(String politicianId) {
        return currentCycle(recipientState(politicianId));
    }

    /**
     * @return The recipient's state, or null if unknown or the lookup failed
     */
    public String recipientState(String politicianId) {
        try {
            Optional<String> state = politicianDirectory.findState(politicianId);
            if (state.isEmpty()) {
                log.warn("No state on record for politician {}, using fallback dates", politicianId);
                metrics.recordDegradedData("politician_state");
            }
            return state.orElse(null);
        } catch (RuntimeException e) {
            log.warn("State lookup failed for politician {}, using fallback dates: {}", politicianId, e.getMessage());
            metrics.recordDegradedData("politician_state");
            return null;
        }
    }

    /**
     * Looks up published dates, substituting the fallback pair when they are unavailable.
     */
    public ElectionDates resolveDates(String state, Instant now) {
        int year = now.atZone(zone).getYear();
        Optional<ElectionDates> published;
        try {
            published = dateProvider.getElectionDates(state);
        } catch (RuntimeException e) {
            log.warn("Election date lookup failed for state {}, using fallback dates: {}", state, e.getMessage());
            metrics.recordDegradedData("election_dates");
            return ElectionDates.fallback(state, year);
        }

        if (published.isEmpty() || published.get().isEmpty()) {
            log.warn("No published election dates for state {}, using fallback dates", state);
            metrics.recordDegradedData("election_dates");
            return ElectionDates.fallback(state, year);
        }
        return published.get();
    }
}
