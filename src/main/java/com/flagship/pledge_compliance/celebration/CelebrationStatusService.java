package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.celebration.event.CelebrationStatusChangedEvent;
import com.flagship.pledge_compliance.exception.ResourceNotFoundException;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import com.flagship.pledge_compliance.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies status transitions to stored celebrations.
 *
 * Each transition runs in one transaction:
 * 1. Load the celebration and validate the transition against the table
 * 2. Conditional UPDATE of status and legacy flags (only if the status is unchanged)
 * 3. Append one ledger entry
 * 4. Write a CelebrationStatusChanged outbox event
 *
 * A rejected transition throws before anything is written. A lost race throws
 * {@link ConcurrentStatusChangeException} and the whole transaction rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CelebrationStatusService {

    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final CelebrationPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    @Transactional
    public Celebration changeStatus(UUID celebrationId, StatusChangeRequest request) {
        Celebration current = getCelebration(celebrationId);
        Celebration updated = current.transition(request, clock.instant());

        persistenceService.applyTransition(current, updated);
        outboxService.saveEvent(CelebrationStatusChangedEvent.from(updated));

        StatusLedgerEntry entry = updated.latestEntry();
        metrics.recordTransition(entry.getNewStatus().getValue(), entry.getTriggeredBy().getValue());
        log.info("Celebration {} moved {} -> {} ({}, by {})",
            celebrationId,
            entry.getPreviousStatus().getValue(),
            entry.getNewStatus().getValue(),
            entry.getReason(),
            entry.getTriggeredByName());
        return updated;
    }

    /**
     * Moves a paused celebration back to active.
     *
     * @param actor who is reactivating; null means the system
     */
    @Transactional
    public Celebration activate(UUID celebrationId, String reason, StatusActor actor) {
        return changeStatus(celebrationId, StatusChangeRequest.builder()
            .targetStatus(CelebrationStatus.ACTIVE)
            .reason(reason)
            .actor(actor != null ? actor : StatusActor.system("System - Activation"))
            .build());
    }

    /**
     * @param pauseDetails recorded under {@code pause_details}, such as an expected resume date
     */
    @Transactional
    public Celebration pause(UUID celebrationId, String reason, Map<String, Object> pauseDetails, StatusActor actor) {
        return changeStatus(celebrationId, StatusChangeRequest.builder()
            .targetStatus(CelebrationStatus.PAUSED)
            .reason(reason)
            .actor(actor != null ? actor : StatusActor.system("System - Pause"))
            .metadata(Map.of("pause_details", nullToEmpty(pauseDetails)))
            .build());
    }

    /**
     * @param resolutionDetails recorded under {@code resolution_details}, such as the legislative action
     */
    @Transactional
    public Celebration resolve(UUID celebrationId, String reason, Map<String, Object> resolutionDetails,
                               StatusActor actor) {
        return changeStatus(celebrationId, StatusChangeRequest.builder()
            .targetStatus(CelebrationStatus.RESOLVED)
            .reason(reason)
            .actor(actor != null ? actor : StatusActor.system("System - Resolution"))
            .metadata(Map.of("resolution_details", nullToEmpty(resolutionDetails)))
            .build());
    }

    /**
     * Driven by the legislative-session signal only. Records defunctDate and defunctReason.
     *
     * @param sessionDetails recorded under {@code congressional_session}
     */
    @Transactional
    public Celebration makeDefunct(UUID celebrationId, String reason, Map<String, Object> sessionDetails) {
        return changeStatus(celebrationId, StatusChangeRequest.builder()
            .targetStatus(CelebrationStatus.DEFUNCT)
            .reason(reason)
            .actor(StatusActor.congressionalSession())
            .metadata(Map.of("congressional_session", nullToEmpty(sessionDetails)))
            .build());
    }

    @Transactional(readOnly = true)
    public Celebration getCelebration(UUID celebrationId) {
        return persistenceService.findById(celebrationId)
            .orElseThrow(() -> new ResourceNotFoundException("Celebration", celebrationId));
    }

    @Transactional(readOnly = true)
    public StatusHistory getStatusHistory(UUID celebrationId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be at least 1");
        }
        Celebration celebration = getCelebration(celebrationId);
        return new StatusHistory(
            persistenceService.countEntries(celebrationId),
            persistenceService.findRecentEntries(celebrationId, limit),
            celebration.getCurrentStatus(),
            StatusDuration.of(celebration, clock.instant())
        );
    }

    @Transactional(readOnly = true)
    public StatusDuration calculateStatusDuration(UUID celebrationId) {
        return StatusDuration.of(getCelebration(celebrationId), clock.instant());
    }

    /**
     * Active and paused celebrations, excluding seed data.
     */
    @Transactional(readOnly = true)
    public List<Celebration> findCelebrationsNeedingUpdates() {
        return persistenceService.findNonSeedByStatus(EnumSet.of(CelebrationStatus.ACTIVE, CelebrationStatus.PAUSED));
    }

    private static Map<String, Object> nullToEmpty(Map<String, Object> details) {
        return details != null ? new HashMap<>(details) : Map.of();
    }
}
