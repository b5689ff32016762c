package com.flagship.pledge_compliance.election;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a set of election dates came from.
 *
 * Verified-tier limits reset on these dates, so callers must be able to tell
 * published dates apart from the generic fallback.
 */
public enum ElectionDateSource {
    AUTHORITATIVE("authoritative"),
    FALLBACK("fallback");

    private final String value;

    ElectionDateSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
