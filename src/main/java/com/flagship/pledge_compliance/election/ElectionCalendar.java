package com.flagship.pledge_compliance.election;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;

/**
 * Federal election calendar helpers.
 */
public final class ElectionCalendar {

    private ElectionCalendar() {
        // Utility class
    }

    /**
     * Federal general election day: the first Tuesday after the first Monday in November.
     */
    public static LocalDate generalElectionDay(int year) {
        LocalDate firstMonday = LocalDate.of(year, Month.NOVEMBER, 1)
            .with(TemporalAdjusters.firstInMonth(DayOfWeek.MONDAY));
        return firstMonday.plusDays(1);
    }

    /**
     * Next federal general election on or after {@code today}. Federal general
     * elections are held in even years only.
     */
    public static LocalDate nextGeneralElection(LocalDate today) {
        int year = today.getYear() % 2 == 0 ? today.getYear() : today.getYear() + 1;
        LocalDate candidate = generalElectionDay(year);
        if (candidate.isBefore(today)) {
            candidate = generalElectionDay(year + 2);
        }
        return candidate;
    }

    /**
     * First day of the two-year campaign window containing {@code today}:
     * January 1 of the odd year.
     */
    public static LocalDate campaignWindowStart(LocalDate today) {
        int startYear = today.getYear() % 2 == 1 ? today.getYear() : today.getYear() - 1;
        return LocalDate.of(startYear, 1, 1);
    }

    /**
     * Last day of the two-year campaign window containing {@code today}:
     * December 31 of the even year.
     */
    public static LocalDate campaignWindowEnd(LocalDate today) {
        return campaignWindowStart(today).plusYears(1).withMonth(12).withDayOfMonth(31);
    }
}
