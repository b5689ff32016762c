package com.flagship.pledge_compliance.celebration;

import java.util.UUID;

/**
 * Thrown when another request changed a celebration's status between our read
 * and our conditional update. Nothing was written; the caller may re-read and retry.
 */
public class ConcurrentStatusChangeException extends IllegalStateException {

    public ConcurrentStatusChangeException(UUID celebrationId, CelebrationStatus expected) {
        super(String.format("Celebration %s is no longer '%s'; its status was changed concurrently",
                celebrationId, expected.getValue()));
    }
}
