package com.flagship.pledge_compliance.outbox;

import com.flagship.pledge_compliance.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    private final OutboxEvent event = OutboxEvent.create("Celebration", UUID.randomUUID(), "CelebrationCreated",
            "{\"eventType\":\"CelebrationCreated\"}", Instant.parse("2026-03-01T15:00:00Z"));

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "celebrationsTopic", "celebrations");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    @Test
    @DisplayName("Sent event is keyed by celebration id and marked published")
    void publishes() {
        when(outboxService.findPublishable(3, 100)).thenReturn(List.of(event));
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("celebrations", 1), 0L, 0, 0L, 0, 0);
        SendResult<String, String> result = new SendResult<>(
                new ProducerRecord<>("celebrations", event.getAggregateId().toString(), event.getPayload()), metadata);
        when(kafkaTemplate.send("celebrations", event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(result));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("CelebrationCreated");
    }

    @Test
    @DisplayName("Failed send at the retry limit is dead-lettered, not marked published")
    void deadLetters() {
        when(outboxService.findPublishable(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(3);

        publisher.publishPendingEvents();

        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("CelebrationCreated");
        verify(outboxMetrics).recordEventDeadLettered("CelebrationCreated");
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Interrupt stops the batch without spending the event's retry budget")
    void interruptStopsBatch() throws Exception {
        OutboxEvent second = OutboxEvent.create("Celebration", UUID.randomUUID(), "CelebrationStatusChanged",
                "{\"eventType\":\"CelebrationStatusChanged\"}", Instant.parse("2026-03-01T15:00:01Z"));
        when(outboxService.findPublishable(3, 100)).thenReturn(List.of(event, second));
        CompletableFuture<SendResult<String, String>> pending = mock(CompletableFuture.class);
        when(pending.get(anyLong(), any(TimeUnit.class))).thenThrow(new InterruptedException("shutdown"));
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(pending);

        try {
            publisher.publishPendingEvents();
        } finally {
            assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        }

        verify(kafkaTemplate, times(1)).send(anyString(), anyString(), anyString());
        verify(outboxService, never()).markFailed(any(), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("CelebrationCreated");
    }
}
