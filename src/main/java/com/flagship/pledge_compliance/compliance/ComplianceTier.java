package com.flagship.pledge_compliance.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Contribution-limit regimes, in ascending order of verification.
 *
 * The declaration order is the tier hierarchy: a higher ordinal is a higher tier.
 * Legacy names ("guest", "compliant") written by earlier clients are accepted
 * as aliases.
 */
public enum ComplianceTier {
    UNVERIFIED("unverified", "guest"),
    VERIFIED("verified", "compliant");

    private final String value;
    private final String legacyName;

    ComplianceTier(String value, String legacyName) {
        this.value = value;
        this.legacyName = legacyName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Position in the tier hierarchy, lowest first.
     */
    public int rank() {
        return ordinal();
    }

    public boolean isHigherThan(ComplianceTier other) {
        return rank() > other.rank();
    }

    /**
     * Parses a stored or submitted tier name.
     *
     * @return The tier, or empty if the name is unknown
     */
    public static Optional<ComplianceTier> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ComplianceTier tier : values()) {
            if (tier.value.equals(normalized) || tier.legacyName.equals(normalized)
                    || tier.name().equalsIgnoreCase(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
