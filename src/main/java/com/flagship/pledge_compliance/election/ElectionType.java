package com.flagship.pledge_compliance.election;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of election dates a state can publish.
 *
 * Declaration order of the first four constants is the evaluation priority used by
 * {@link ElectionCycleCalculator}: it is a tie-break policy, not a date ordering.
 */
public enum ElectionType {
    PRIMARY("primary"),
    GENERAL("general"),
    RUNOFF("runoff"),
    SPECIAL("special"),

    /**
     * No configured election date has passed yet; the cycle is waiting on the next one.
     */
    UPCOMING("upcoming");

    private final String value;

    ElectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Date-bearing types in evaluation priority order.
     */
    static final ElectionType[] PRIORITY = {PRIMARY, GENERAL, RUNOFF, SPECIAL};
}
