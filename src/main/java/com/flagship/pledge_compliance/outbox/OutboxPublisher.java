package com.flagship.pledge_compliance.outbox;

import com.flagship.pledge_compliance.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes celebration events to Kafka.
 *
 * - Sends synchronously, keyed by celebration id, so events for one pledge stay ordered
 * - A failed send bumps the retry count; at max retries the event is dead-lettered
 *   and left in the table for manual replay
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.celebrations:celebrations}")
    private String celebrationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                if (!publishEvent(event)) {
                    log.warn("Outbox publisher interrupted, leaving {} event(s) for the next run",
                        events.size() - events.indexOf(event));
                    return;
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * @return false if the thread was interrupted and the batch must stop
     */
    boolean publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(celebrationsTopic, event.getAggregateId().toString(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;
        } catch (InterruptedException e) {
            // Shutdown, not a broker fault: the event keeps its retry budget
            Thread.currentThread().interrupt();
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            int retries = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (retries >= maxRetries) {
                log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, celebrationId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return true;
        }
    }
}
