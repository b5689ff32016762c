package com.flagship.pledge_compliance.celebration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who caused a status change.
 */
public enum TriggerType {
    SYSTEM("system"),
    CONGRESSIONAL_SESSION("congressional_session"),
    USER_ACTION("user_action");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
