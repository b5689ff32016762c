package com.flagship.pledge_compliance.celebration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CelebrationTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T15:00:00Z");

    @Test
    @DisplayName("New celebration is active with a none-to-active creation entry")
    void creationEntry() {
        Celebration celebration = newCelebration();

        assertEquals(CelebrationStatus.ACTIVE, celebration.getCurrentStatus());
        assertEquals(1, celebration.getStatusLedger().size());
        StatusLedgerEntry entry = celebration.latestEntry();
        assertTrue(entry.isCreationEntry());
        assertNull(entry.getPreviousStatus());
        assertEquals(CelebrationStatus.ACTIVE, entry.getNewStatus());
        assertEquals(1, entry.getSequenceNumber());
        assertEquals(TriggerType.SYSTEM, entry.getTriggeredBy());
        assertEquals("verified", entry.getComplianceTierAtTime());
        assertEquals("203.0.113.7", entry.getAuditTrail().getIpAddress());
        assertFalse(celebration.isResolved() || celebration.isPaused() || celebration.isDefunct());
    }

    @Test
    @DisplayName("Non-positive donation or negative tip cannot be created")
    void invalidAmounts() {
        assertThrows(IllegalArgumentException.class, () -> Celebration.create(UUID.randomUUID(), UUID.randomUUID(),
                "pol-a", "hr-1", "TX", BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null, CREATED));
        assertThrows(IllegalArgumentException.class, () -> Celebration.create(UUID.randomUUID(), UUID.randomUUID(),
                "pol-a", "hr-1", "TX", BigDecimal.TEN, new BigDecimal("-1"), BigDecimal.ZERO, null, null, CREATED));
    }

    @Test
    @DisplayName("Pause then resume appends one entry each and keeps status in step with the ledger")
    void pauseAndResume() {
        Instant pausedAt = CREATED.plus(2, ChronoUnit.DAYS);
        Instant resumedAt = CREATED.plus(5, ChronoUnit.DAYS);

        Celebration paused = newCelebration().transition(request(CelebrationStatus.PAUSED, "Donor asked to pause",
                StatusActor.user("user-1", "Jane Doe", AuditTrail.EMPTY),
                Map.of("pause_details", Map.of("expected_resume", "2026-04-01"))), pausedAt);
        Celebration resumed = paused.transition(request(CelebrationStatus.ACTIVE, "Resumed",
                StatusActor.system("System - Activation"), Map.of()), resumedAt);

        assertTrue(paused.isPaused());
        assertEquals(CelebrationStatus.ACTIVE, resumed.getCurrentStatus());
        assertEquals(3, resumed.getStatusLedger().size());
        StatusLedgerEntry pauseEntry = resumed.getStatusLedger().get(1);
        assertEquals(CelebrationStatus.ACTIVE, pauseEntry.getPreviousStatus());
        assertEquals(TriggerType.USER_ACTION, pauseEntry.getTriggeredBy());
        assertEquals("user-1", pauseEntry.getTriggeredById());
        assertTrue(pauseEntry.getMetadata().containsKey("pause_details"));
        assertEquals(3, resumed.latestEntry().getSequenceNumber());
        assertEquals(resumed.getCurrentStatus(), resumed.latestEntry().getNewStatus());
        assertEquals(resumedAt, resumed.getUpdatedAt());
    }

    @Test
    @DisplayName("Resolved to active is rejected and the ledger is unchanged")
    void resolvedIsTerminal() {
        Celebration resolved = newCelebration().transition(request(CelebrationStatus.RESOLVED, "Bill passed",
                StatusActor.system("System - Resolution"), Map.of()), CREATED.plusSeconds(60));
        List<StatusLedgerEntry> before = resolved.getStatusLedger();

        assertThrows(InvalidTransitionException.class, () -> resolved.transition(request(CelebrationStatus.ACTIVE,
                "Reopen", StatusActor.system("System"), Map.of()), CREATED.plusSeconds(120)));

        assertEquals(CelebrationStatus.RESOLVED, resolved.getCurrentStatus());
        assertSame(before, resolved.getStatusLedger());
        assertEquals(2, resolved.getStatusLedger().size());
    }

    @Test
    @DisplayName("Defunct records the date and reason")
    void defunctDetails() {
        Instant at = Instant.parse("2027-01-03T05:00:00Z");

        Celebration defunct = newCelebration().transition(request(CelebrationStatus.DEFUNCT,
                "Congressional session ended without action on target bill",
                StatusActor.congressionalSession(), Map.of("congressional_session", Map.of("session_number", 119))), at);

        assertTrue(defunct.isDefunct());
        assertEquals(at, defunct.getDefunctDate());
        assertEquals("Congressional session ended without action on target bill", defunct.getDefunctReason());
        assertEquals(TriggerType.CONGRESSIONAL_SESSION, defunct.latestEntry().getTriggeredBy());
        assertEquals("Congressional Session End", defunct.latestEntry().getTriggeredByName());
    }

    @Test
    @DisplayName("Duration counts whole days since the last change and since creation")
    void duration() {
        Celebration paused = newCelebration().transition(request(CelebrationStatus.PAUSED, "Pause",
                StatusActor.system("System - Pause"), Map.of()), CREATED.plus(3, ChronoUnit.DAYS));

        StatusDuration duration = StatusDuration.of(paused, CREATED.plus(10, ChronoUnit.DAYS).plusSeconds(3600));

        assertEquals(7, duration.getCurrentStatusDurationDays());
        assertEquals(10, duration.getTotalLifetimeDays());
        assertEquals(CREATED.plus(3, ChronoUnit.DAYS), duration.getLastChangeDate());
    }

    private static StatusChangeRequest request(CelebrationStatus target, String reason, StatusActor actor,
                                               Map<String, Object> metadata) {
        return StatusChangeRequest.builder()
                .targetStatus(target)
                .reason(reason)
                .actor(actor)
                .metadata(metadata)
                .build();
    }

    private static Celebration newCelebration() {
        DonorInfoSnapshot snapshot = new DonorInfoSnapshot("Jane", "Doe", "jane@example.com", "12 Main St",
                "Austin", "TX", "78701", "US", null, true, "Engineer", "Acme", "verified",
                ValidationFlags.of(List.of(), CREATED));
        return Celebration.create(UUID.randomUUID(), UUID.randomUUID(), "pol-a", "hr-1", "TX",
                new BigDecimal("100.00"), new BigDecimal("5.00"), new BigDecimal("3.20"), snapshot,
                new AuditTrail("203.0.113.7", "JUnit", "session-1"), CREATED);
    }
}
