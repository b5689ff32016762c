package com.flagship.pledge_compliance.compliance;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar-year boundaries in the compliance zone.
 *
 * The annual cap and the PAC limit start over at local midnight between
 * December 31 and January 1, so the boundary moves with daylight saving and
 * never follows the server's zone or raw UTC.
 */
@Component
public class AnnualResetBoundary {

    private final ZoneId zone;

    public AnnualResetBoundary(ZoneId complianceZone) {
        this.zone = complianceZone;
    }

    /**
     * First instant of the calendar year containing {@code now}.
     */
    public Instant currentPeriodStart(Instant now) {
        int year = now.atZone(zone).getYear();
        return LocalDate.of(year, 1, 1).atStartOfDay(zone).toInstant();
    }

    /**
     * First instant of the following calendar year.
     */
    public Instant nextReset(Instant now) {
        int year = now.atZone(zone).getYear();
        return LocalDate.of(year + 1, 1, 1).atStartOfDay(zone).toInstant();
    }

    public ZoneId getZone() {
        return zone;
    }
}
