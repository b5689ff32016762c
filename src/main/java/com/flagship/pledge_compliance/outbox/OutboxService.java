package com.flagship.pledge_compliance.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_compliance.celebration.event.CelebrationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes celebration events to the outbox inside the caller's transaction and
 * tracks their publishing state.
 *
 * Usage:
 * 1. Call saveEvent() from a @Transactional business method
 * 2. The event commits or rolls back with the business change
 * 3. OutboxPublisher later sends it to Kafka
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Celebration";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves an event to the outbox. Must run inside an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(CelebrationEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
            AGGREGATE_TYPE, event.getCelebrationId(), event.getEventType(),
            serializePayload(event), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, celebrationId={}", event.getEventType(), event.getCelebrationId());
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch for one publisher. Uses SKIP LOCKED so
     * several publisher instances can run side by side.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the retry count after this failure, or -1 if the event is gone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(-1);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForCelebration(UUID celebrationId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(celebrationId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
