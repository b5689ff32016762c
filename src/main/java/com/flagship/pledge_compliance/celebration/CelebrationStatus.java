package com.flagship.pledge_compliance.celebration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a celebration (an escrowed pledge).
 *
 * Status fields are not "just columns": every change goes through
 * {@link CelebrationStatusMachine} and leaves a ledger entry.
 */
public enum CelebrationStatus {
    /**
     * Escrowed and waiting for the tracked legislative event.
     * Initial state for all celebrations.
     */
    ACTIVE("active"),

    /**
     * Temporarily on hold. Can be reactivated or made defunct.
     */
    PAUSED("paused"),

    /**
     * The tracked legislative event happened.
     * Terminal state.
     */
    RESOLVED("resolved"),

    /**
     * The legislative session ended without the event.
     * Terminal state.
     */
    DEFUNCT("defunct");

    private final String value;

    CelebrationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == DEFUNCT;
    }

    /**
     * Parses a status name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a status
     */
    @JsonCreator
    public static CelebrationStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (CelebrationStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown celebration status: " + value);
    }
}
