package com.flagship.pledge_compliance.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event, used to drop redeliveries.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(EventKey key, Instant processedAt) {
        return of(key, processedAt, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(EventKey key, Instant processedAt, String reason) {
        return of(key, processedAt, ProcessingResult.SKIPPED, reason);
    }

    private static ProcessedEvent of(EventKey key, Instant processedAt, ProcessingResult result, String message) {
        return new ProcessedEvent(key.getEventId(), key.getEventType(), key.getAggregateType(),
            key.getAggregateId(), key.getConsumerGroup(), processedAt, result, message);
    }

    /**
     * Identity of one delivery target: an event as seen by one consumer group.
     */
    @Value
    public static class EventKey {
        UUID eventId;
        String eventType;
        String aggregateType;
        UUID aggregateId;
        String consumerGroup;
    }
}
