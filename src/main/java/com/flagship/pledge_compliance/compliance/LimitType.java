package com.flagship.pledge_compliance.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which limit an attempted donation would break.
 */
public enum LimitType {
    PER_DONATION("per-donation"),
    ANNUAL_CAP("annual-cap"),
    PER_ELECTION("per-election");

    private final String value;

    LimitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
