package com.flagship.pledge_compliance.election;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

/**
 * Computes the current election-cycle window from a state's election dates.
 *
 * Rules:
 * - Date types are evaluated in the fixed order primary, general, runoff, special.
 *   The first one whose date is on or before "now" opens the current cycle.
 * - The cycle ends one millisecond before the next configured date that falls
 *   after the opening date, or on the last instant of the year two years out.
 * - If no date has passed the cycle is "upcoming": it starts at the previous
 *   cycle's generic general election and ends just before the earliest future date.
 *
 * Dates are civil dates in the compliance zone; each starts at local midnight.
 * Pure computation, no I/O.
 */
@Component
public class ElectionCycleCalculator {

    private final ZoneId zone;

    public ElectionCycleCalculator(ZoneId complianceZone) {
        this.zone = complianceZone;
    }

    /**
     * Calculates the cycle in effect at {@code now}.
     *
     * @param dates Election dates for one state (authoritative or fallback)
     * @param now Evaluation instant
     * @return The cycle window, never null
     */
    public ElectionCycle calculate(ElectionDates dates, Instant now) {
        if (dates == null) {
            throw new IllegalArgumentException("Election dates are required");
        }
        int currentYear = now.atZone(zone).getYear();
        Map<ElectionType, LocalDate> configured = dates.configured();
        Instant nextElection = earliestAfter(configured, now);

        for (ElectionType type : ElectionType.PRIORITY) {
            LocalDate date = configured.get(type);
            if (date == null) {
                continue;
            }
            Instant start = startOf(date);
            if (!start.isAfter(now)) {
                Instant following = earliestAfter(configured, start);
                Instant end = following != null
                    ? following.minusMillis(1)
                    : endOfYear(currentYear + 2);
                return ElectionCycle.builder()
                    .state(dates.getState())
                    .currentElectionType(type)
                    .inElectionCycle(true)
                    .cycleStartDate(start)
                    .cycleEndDate(end)
                    .nextElectionDate(nextElection)
                    .source(dates.getSource())
                    .build();
            }
        }

        // Nothing has happened yet: backdate to the previous cycle's general election.
        Instant previousGeneral = startOf(ElectionDates.fallback(dates.getState(), currentYear - 2).getGeneral());
        Instant end = nextElection != null ? nextElection.minusMillis(1) : endOfYear(currentYear + 2);
        return ElectionCycle.builder()
            .state(dates.getState())
            .currentElectionType(ElectionType.UPCOMING)
            .inElectionCycle(false)
            .cycleStartDate(previousGeneral)
            .cycleEndDate(end)
            .nextElectionDate(nextElection)
            .source(dates.getSource())
            .build();
    }

    private Instant earliestAfter(Map<ElectionType, LocalDate> configured, Instant after) {
        Instant earliest = null;
        for (LocalDate date : configured.values()) {
            Instant start = startOf(date);
            if (start.isAfter(after) && (earliest == null || start.isBefore(earliest))) {
                earliest = start;
            }
        }
        return earliest;
    }

    private Instant startOf(LocalDate date) {
        return date.atStartOfDay(zone).toInstant();
    }

    private Instant endOfYear(int year) {
        return LocalDate.of(year + 1, 1, 1).atStartOfDay(zone).toInstant().minusMillis(1);
    }
}
