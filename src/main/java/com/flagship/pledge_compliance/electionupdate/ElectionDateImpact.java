package com.flagship.pledge_compliance.electionupdate;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What a change of a state's election dates means for one donor.
 *
 * {@code oldLimit} and {@code newLimit} are the donor's remaining
 * per-election room under each calendar, across their recipients in the state.
 */
@Value
public class ElectionDateImpact {

    static final String LIMIT_INCREASED =
        "Your donation limit has increased, giving you more flexibility to support causes you care about.";
    static final String LIMIT_DECREASED =
        "Your donation limit has decreased, which may affect your ability to make new Celebrations.";
    static final String TIMELINE_CHANGED =
        "The election timeline has changed, which affects when your donation limits reset.";

    boolean hasImpact;
    BigDecimal oldLimit;
    BigDecimal newLimit;
    boolean limitChanged;
    String description;

    static ElectionDateImpact none(String reason) {
        return new ElectionDateImpact(false, null, null, false, reason);
    }
}
