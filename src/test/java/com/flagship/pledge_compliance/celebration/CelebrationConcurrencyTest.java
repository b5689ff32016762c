package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorService;
import com.flagship.pledge_compliance.exception.ComplianceViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent writers against a real database.
 *
 * Two guards are exercised here:
 * 1. The donor row lock serializes pledges by one donor, so an aggregate cap
 *    cannot be passed by two pledges that each fit on their own
 * 2. The conditional status update lets exactly one of two racing transitions
 *    win; the other writes nothing
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CelebrationConcurrencyTest {

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
    private CelebrationService celebrationService;

    @Autowired
    private CelebrationStatusService statusService;

    @Autowired
    private CelebrationPersistenceService persistenceService;

    @Autowired
    private DonorService donorService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID donorId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        donorId = donorService.register(Donor.builder()
                .email("race-" + UUID.randomUUID() + "@example.com")
                .firstName("Riley")
                .lastName("Chen")
                .build()).getId();
    }

    @Test
    @DisplayName("Two racing pledges that each fit under the annual cap cannot both succeed")
    void testConcurrentPledges_OnlyOneFitsUnderCap() throws InterruptedException {
        printTestHeader("Concurrent Pledges - Annual Cap");
        for (int i = 0; i < 4; i++) {
            create("45.00");
        }

        int threadCount = 2;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();

        System.out.println("Donor " + donorId + " has given $180 of $200; two threads each pledge $15");
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    create("15.00");
                    created.incrementAndGet();
                } catch (ComplianceViolationException e) {
                    rejected.incrementAndGet();
                } catch (Throwable e) {
                    unexpected.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Both pledges should finish");
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertEquals(1, created.get());
        assertEquals(1, rejected.get());
        BigDecimal total = jdbcTemplate.queryForObject(
                "SELECT SUM(donation_amount) FROM celebrations WHERE donor_id = ?", BigDecimal.class, donorId);
        assertEquals(0, total.compareTo(new BigDecimal("195.00")));
        printSuccess("One pledge stored, one rejected, total $" + total);
    }

    @Test
    @DisplayName("Two racing transitions from the same status leave one winner and one ledger row")
    void testConcurrentTransitions_OneWinner() throws InterruptedException {
        printTestHeader("Concurrent Transitions - One Winner");
        Celebration current = create("20.00");
        Instant now = Instant.now();
        List<Celebration> attempts = List.of(
                current.transition(StatusChangeRequest.builder()
                        .targetStatus(CelebrationStatus.PAUSED)
                        .reason("Donor asked to pause")
                        .actor(StatusActor.system("System - Pause"))
                        .metadata(Map.of())
                        .build(), now),
                current.transition(StatusChangeRequest.builder()
                        .targetStatus(CelebrationStatus.RESOLVED)
                        .reason("Bill passed")
                        .actor(StatusActor.system("System - Resolution"))
                        .metadata(Map.of())
                        .build(), now));

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(attempts.size());
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger lost = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();

        ExecutorService executor = Executors.newFixedThreadPool(attempts.size());
        for (Celebration updated : attempts) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transactionTemplate.executeWithoutResult(
                            tx -> persistenceService.applyTransition(current, updated));
                    applied.incrementAndGet();
                } catch (ConcurrentStatusChangeException e) {
                    lost.incrementAndGet();
                } catch (Throwable e) {
                    unexpected.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Both transitions should finish");
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertEquals(1, applied.get());
        assertEquals(1, lost.get());

        Celebration stored = statusService.getCelebration(current.getId());
        assertEquals(2, stored.getStatusLedger().size());
        assertEquals(stored.getCurrentStatus(), stored.latestEntry().getNewStatus());
        assertTrue(stored.isPaused() || stored.isResolved());
        printSuccess("Winner: " + stored.getCurrentStatus().getValue());
    }

    private Celebration create(String donation) {
        CreateCelebrationCommand command = CreateCelebrationCommand.builder()
                .donorId(donorId)
                .politicianId("pol-" + UUID.randomUUID())
                .billId("hr-7")
                .donation(new BigDecimal(donation))
                .tip(BigDecimal.ZERO)
                .build();
        return celebrationService.createCelebration(command, UUID.randomUUID().toString(), AuditTrail.EMPTY)
                .getCelebration();
    }
}
