package com.flagship.pledge_compliance.celebration;

import lombok.Value;

/**
 * A created pledge, or the one previously created under the same idempotency key.
 */
@Value
public class CreationResult {
    Celebration celebration;
    boolean replayed;
}
