package com.flagship.pledge_compliance.celebration;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Validation result frozen into a donor-info snapshot.
 * Flags are informational for committee review and never block a pledge.
 */
@Value
public class ValidationFlags {
    public static final String VERSION = "1.0";

    boolean flagged;
    int totalFlags;
    List<ValidationFlag> flags;
    Instant validatedAt;
    String validationVersion;

    public static ValidationFlags of(List<ValidationFlag> flags, Instant validatedAt) {
        List<ValidationFlag> copy = List.copyOf(flags);
        return new ValidationFlags(!copy.isEmpty(), copy.size(), copy, validatedAt, VERSION);
    }
}
