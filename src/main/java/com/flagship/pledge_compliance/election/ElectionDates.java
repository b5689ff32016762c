package com.flagship.pledge_compliance.election;

import lombok.Value;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Election dates published for one state. Any of the four dates may be absent.
 */
@Value
public class ElectionDates {
    String state;
    LocalDate primary;
    LocalDate general;
    LocalDate runoff;
    LocalDate special;
    ElectionDateSource source;

    /**
     * Generic same-year dates used when a state has no published calendar:
     * primary on June 1 and general on November 5.
     */
    public static ElectionDates fallback(String state, int year) {
        return new ElectionDates(
            state,
            LocalDate.of(year, 6, 1),
            LocalDate.of(year, 11, 5),
            null,
            null,
            ElectionDateSource.FALLBACK
        );
    }

    public static ElectionDates authoritative(String state, LocalDate primary, LocalDate general,
                                              LocalDate runoff, LocalDate special) {
        return new ElectionDates(state, primary, general, runoff, special, ElectionDateSource.AUTHORITATIVE);
    }

    public LocalDate dateFor(ElectionType type) {
        return switch (type) {
            case PRIMARY -> primary;
            case GENERAL -> general;
            case RUNOFF -> runoff;
            case SPECIAL -> special;
            case UPCOMING -> null;
        };
    }

    /**
     * Configured dates keyed by type, in priority order.
     */
    public Map<ElectionType, LocalDate> configured() {
        Map<ElectionType, LocalDate> dates = new EnumMap<>(ElectionType.class);
        for (ElectionType type : ElectionType.PRIORITY) {
            LocalDate date = dateFor(type);
            if (date != null) {
                dates.put(type, date);
            }
        }
        return dates;
    }

    public boolean isEmpty() {
        return primary == null && general == null && runoff == null && special == null;
    }

    public boolean isFallback() {
        return source == ElectionDateSource.FALLBACK;
    }
}
