package com.flagship.pledge_compliance.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a tier's aggregate limit starts over.
 */
public enum ResetType {
    /** Midnight Eastern between December 31 and January 1. */
    ANNUAL("annual"),
    /** At the state's next election date. */
    ELECTION_CYCLE("election_cycle");

    private final String value;

    ResetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
