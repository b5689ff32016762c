package com.flagship.pledge_compliance.celebration.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for celebration events written to the outbox.
 *
 * Every event carries its own id so consumers can de-duplicate replays.
 */
public interface CelebrationEvent {

    UUID getEventId();

    UUID getCelebrationId();

    UUID getDonorId();

    Instant getOccurredAt();

    String getEventType();
}
