package com.flagship.pledge_compliance.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * At-most-once handling of celebration events per consumer group.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("pledge_compliance_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private ProcessedEvent.EventKey key(UUID eventId, String consumerGroup) {
        return new ProcessedEvent.EventKey(eventId, "CelebrationCreated", "Celebration", UUID.randomUUID(), consumerGroup);
    }

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void testFirstDelivery() {
        printTestHeader("First Delivery");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(key(eventId, CONSUMER_GROUP), calls::incrementAndGet);

        assertTrue(processed);
        assertEquals(1, calls.get());
        assertTrue(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP));
    }

    @Test
    @DisplayName("Redelivery is dropped without running the handler")
    void testRedelivery() {
        printTestHeader("Redelivery");
        ProcessedEvent.EventKey key = key(UUID.randomUUID(), CONSUMER_GROUP);
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.processEvent(key, calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(key, calls::incrementAndGet);

        assertFalse(second);
        assertEquals(1, calls.get());
        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("Consumer groups track the same event independently")
    void testConsumerGroupsIndependent() {
        printTestHeader("Independent Consumer Groups");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertTrue(eventProcessor.processEvent(key(eventId, "group-a"), calls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(key(eventId, "group-b"), calls::incrementAndGet));

        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("A failing handler leaves no record so the event is retried")
    void testFailedHandlerRetried() {
        printTestHeader("Failed Handler");
        ProcessedEvent.EventKey key = key(UUID.randomUUID(), CONSUMER_GROUP);

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(key, () -> {
            throw new IllegalStateException("handler failed");
        }));
        assertFalse(eventProcessor.isAlreadyProcessed(key));

        AtomicInteger calls = new AtomicInteger();
        assertTrue(eventProcessor.processEvent(key, calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A skipped event is not processed later")
    void testSkippedEvent() {
        printTestHeader("Skipped Event");
        ProcessedEvent.EventKey key = key(UUID.randomUUID(), CONSUMER_GROUP);

        eventProcessor.skipEvent(key, "Unknown event type");
        eventProcessor.skipEvent(key, "Unknown event type");

        AtomicInteger calls = new AtomicInteger();
        assertFalse(eventProcessor.processEvent(key, calls::incrementAndGet));
        assertEquals(0, calls.get());
        assertEquals(1, repository.count());
    }
}
