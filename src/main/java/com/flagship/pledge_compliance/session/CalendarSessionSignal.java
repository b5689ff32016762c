package com.flagship.pledge_compliance.session;

import com.flagship.pledge_compliance.election.ElectionCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Session signal derived from the congressional calendar.
 *
 * A session opens on January 3 and, unless {@code congress.session.end-date}
 * supplies the real adjournment date, is assumed to run until January 3 of the
 * following year. Dates are read in the compliance zone.
 */
@Component
@Slf4j
public class CalendarSessionSignal implements LegislativeSessionSignal {

    static final int FIRST_CONGRESS_YEAR = 1787;
    static final String REGULAR_SESSION = "regular";

    private final Clock clock;
    private final ZoneId zone;
    private final LocalDate configuredEndDate;
    private final int warningPeriodDays;

    public CalendarSessionSignal(
            Clock clock,
            ZoneId complianceZone,
            @Value("${congress.session.end-date:}") String configuredEndDate,
            @Value("${congress.session.warning-period-days:30}") int warningPeriodDays) {
        if (warningPeriodDays < 0) {
            throw new IllegalArgumentException("Warning period must not be negative: " + warningPeriodDays);
        }
        this.clock = clock;
        this.zone = complianceZone;
        this.configuredEndDate = parseEndDate(configuredEndDate);
        this.warningPeriodDays = warningPeriodDays;
    }

    @Override
    public boolean isSessionEnded() {
        return getSessionInfo().isHasEnded();
    }

    @Override
    public boolean isInWarningPeriod() {
        return getSessionInfo().isInWarningPeriod();
    }

    @Override
    public SessionInfo getSessionInfo() {
        Instant now = clock.instant();
        LocalDate today = now.atZone(zone).toLocalDate();
        int year = today.getYear();

        boolean authoritative = configuredEndDate != null;
        LocalDate endDate = authoritative ? configuredEndDate : LocalDate.of(year + 1, 1, 3);
        LocalDate warningStart = endDate.minusDays(warningPeriodDays);

        Instant endInstant = endDate.atStartOfDay(zone).toInstant();
        Instant warningInstant = warningStart.atStartOfDay(zone).toInstant();
        boolean ended = !now.isBefore(endInstant);
        boolean warning = !ended && !now.isBefore(warningInstant);

        return SessionInfo.builder()
            .congressNumber(congressNumber(year))
            .sessionNumber(year % 2 == 0 ? 2 : 1)
            .sessionType(REGULAR_SESSION)
            .sessionStartDate(LocalDate.of(year, 1, 3))
            .sessionEndDate(endDate)
            .nextElectionDate(ElectionCalendar.nextGeneralElection(today))
            .warningPeriodStart(warningStart)
            .endDateSource(authoritative ? SessionInfo.EndDateSource.AUTHORITATIVE : SessionInfo.EndDateSource.FALLBACK)
            .inWarningPeriod(warning)
            .hasEnded(ended)
            .evaluatedAt(now)
            .build();
    }

    static int congressNumber(int year) {
        return Math.floorDiv(year - FIRST_CONGRESS_YEAR, 2);
    }

    private static LocalDate parseEndDate(String value) {
        if (!StringUtils.hasText(value)) {
            log.info("No congress.session.end-date configured, using the January 3 fallback");
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid congress.session.end-date: " + value, e);
        }
    }
}
