package com.flagship.pledge_compliance.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_compliance.celebration.event.CelebrationCreatedEvent;
import com.flagship.pledge_compliance.celebration.event.CelebrationStatusChangedEvent;
import com.flagship.pledge_compliance.celebration.event.TipLimitReachedEvent;
import com.flagship.pledge_compliance.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for celebration events.
 *
 * Offsets are acknowledged manually after the handler commits. Unparseable
 * messages are acknowledged and dropped; handler failures are rethrown so the
 * message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CelebrationEventConsumer {

    static final String CONSUMER_GROUP = "celebration-notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final CelebrationEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.celebrations:celebrations}",
        groupId = "${spring.kafka.consumer.group-id:pledge-compliance-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        ProcessedEvent.EventKey key = parseKey(record.value());
        if (key == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(key, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, celebrationId={}",
                        key.getEventType(), key.getEventId(), key.getAggregateId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}", key.getEventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean route(ProcessedEvent.EventKey key, String payload) {
        return switch (key.getEventType()) {
            case CelebrationCreatedEvent.EVENT_TYPE -> eventProcessor.processEvent(key,
                () -> eventHandler.onCelebrationCreated(deserialize(payload, CelebrationCreatedEvent.class)));
            case TipLimitReachedEvent.EVENT_TYPE -> eventProcessor.processEvent(key,
                () -> eventHandler.onTipLimitReached(deserialize(payload, TipLimitReachedEvent.class)));
            case CelebrationStatusChangedEvent.EVENT_TYPE -> eventProcessor.processEvent(key,
                () -> eventHandler.onStatusChanged(deserialize(payload, CelebrationStatusChangedEvent.class)));
            default -> {
                log.debug("Unknown event type {}, skipping", key.getEventType());
                eventProcessor.skipEvent(key, "Unknown event type");
                yield false;
            }
        };
    }

    ProcessedEvent.EventKey parseKey(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.hasNonNull("eventId") || !node.hasNonNull("celebrationId") || !node.hasNonNull("eventType")) {
                return null;
            }
            return new ProcessedEvent.EventKey(
                UUID.fromString(node.get("eventId").asText()),
                node.get("eventType").asText(),
                OutboxService.AGGREGATE_TYPE,
                UUID.fromString(node.get("celebrationId").asText()),
                CONSUMER_GROUP
            );
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
