package com.flagship.pledge_compliance.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The processed_events row is written in the same transaction as the handler's
 * own writes. A handler that throws leaves no row behind, so the redelivered
 * message is attempted again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(ProcessedEvent.EventKey key, Runnable handler) {
        if (isAlreadyProcessed(key)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    key.getEventId(), key.getConsumerGroup());
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(key, clock.instant())));
        log.debug("Processed event {} ({}) by consumer group {}",
                key.getEventId(), key.getEventType(), key.getConsumerGroup());
        return true;
    }

    /**
     * Records an event this consumer does not handle so it is not examined again.
     */
    @Transactional
    public void skipEvent(ProcessedEvent.EventKey key, String reason) {
        if (isAlreadyProcessed(key)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(key, clock.instant(), reason)));
        log.debug("Skipped event {} by consumer group {}: {}", key.getEventId(), key.getConsumerGroup(), reason);
    }

    public boolean isAlreadyProcessed(ProcessedEvent.EventKey key) {
        return repository.existsByEventIdAndConsumerGroup(key.getEventId(), key.getConsumerGroup());
    }
}
