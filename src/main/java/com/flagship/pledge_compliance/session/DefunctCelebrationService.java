package com.flagship.pledge_compliance.session;

import com.flagship.pledge_compliance.celebration.Celebration;
import com.flagship.pledge_compliance.celebration.CelebrationPersistenceService;
import com.flagship.pledge_compliance.celebration.CelebrationStatus;
import com.flagship.pledge_compliance.celebration.CelebrationStatusService;
import com.flagship.pledge_compliance.celebration.DonorInfoSnapshot;
import com.flagship.pledge_compliance.notification.Notification;
import com.flagship.pledge_compliance.notification.NotificationDispatcher;
import com.flagship.pledge_compliance.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ages out pledges when the congressional session ends.
 *
 * Every conversion runs in its own transaction through the status machine,
 * so one failed pledge neither blocks nor rolls back the others. Pledges that
 * were resolved or paused are left alone. Donors hear about it once per run,
 * however many of their pledges were converted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefunctCelebrationService {

    public static final String DEFUNCT_REASON = "Congressional session ended without action on target bill";

    private final LegislativeSessionSignal sessionSignal;
    private final CelebrationPersistenceService persistenceService;
    private final CelebrationStatusService statusService;
    private final NotificationDispatcher notificationDispatcher;

    public DefunctConversionSummary convertActiveCelebrationsToDefunct() {
        SessionInfo session = sessionSignal.getSessionInfo();
        List<Celebration> active = findActive();
        if (active.isEmpty()) {
            log.info("Session check: no active celebrations to convert");
            return DefunctConversionSummary.nothingToDo(session);
        }

        Map<String, Object> sessionDetails = sessionDetails(session);
        Map<UUID, List<Celebration>> convertedByDonor = new LinkedHashMap<>();
        int failed = 0;

        for (Celebration celebration : active) {
            try {
                Celebration converted = statusService.makeDefunct(celebration.getId(), DEFUNCT_REASON, sessionDetails);
                convertedByDonor.computeIfAbsent(converted.getDonorId(), k -> new ArrayList<>()).add(converted);
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to convert celebration {} to defunct: {}", celebration.getId(), e.getMessage(), e);
            }
        }

        int notified = 0;
        for (List<Celebration> celebrations : convertedByDonor.values()) {
            if (notificationDispatcher.dispatch(defunctNotice(celebrations, session))) {
                notified++;
            }
        }

        int converted = convertedByDonor.values().stream().mapToInt(List::size).sum();
        log.info("Converted {} celebration(s) to defunct ({} failed), notified {} donor(s), congress {} session {}",
            converted, failed, notified, session.getCongressNumber(), session.getSessionNumber());
        return new DefunctConversionSummary(converted, failed, notified, session);
    }

    /**
     * Warns each donor with active pledges once. Outside the warning period nothing is sent.
     *
     * @return number of donors warned
     */
    public int sendWarningNotifications() {
        SessionInfo session = sessionSignal.getSessionInfo();
        if (!session.isInWarningPeriod()) {
            log.debug("Not in the session warning period, skipping warnings");
            return 0;
        }

        Map<UUID, List<Celebration>> byDonor = new LinkedHashMap<>();
        for (Celebration celebration : findActive()) {
            byDonor.computeIfAbsent(celebration.getDonorId(), k -> new ArrayList<>()).add(celebration);
        }

        int warned = 0;
        for (List<Celebration> celebrations : byDonor.values()) {
            if (notificationDispatcher.dispatch(warningNotice(celebrations, session))) {
                warned++;
            }
        }
        log.info("Sent defunct warnings to {} of {} donor(s), session ends {}",
            warned, byDonor.size(), session.getSessionEndDate());
        return warned;
    }

    public SessionCheckResult checkAndConvertIfNeeded() {
        SessionInfo session = sessionSignal.getSessionInfo();
        if (session.isHasEnded()) {
            log.info("Congressional session ended on {}, converting active celebrations", session.getSessionEndDate());
            return new SessionCheckResult(SessionCheckResult.Action.CONVERTED,
                convertActiveCelebrationsToDefunct(), 0, session);
        }
        if (session.isInWarningPeriod()) {
            return new SessionCheckResult(SessionCheckResult.Action.WARNED, null, sendWarningNotifications(), session);
        }
        return new SessionCheckResult(SessionCheckResult.Action.NO_ACTION, null, 0, session);
    }

    private List<Celebration> findActive() {
        return persistenceService.findNonSeedByStatus(EnumSet.of(CelebrationStatus.ACTIVE));
    }

    static Map<String, Object> sessionDetails(SessionInfo session) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_number", session.getCongressNumber());
        details.put("session_end_date", session.getSessionEndDate().toString());
        details.put("session_type", session.getSessionType());
        return details;
    }

    private static Notification defunctNotice(List<Celebration> celebrations, SessionInfo session) {
        DonorInfoSnapshot donor = celebrations.get(0).getDonorInfo();
        return Notification.builder()
            .type(NotificationType.CELEBRATION_DEFUNCT)
            .donorId(celebrations.get(0).getDonorId())
            .recipientEmail(donor != null ? donor.getEmail() : null)
            .subject("Your celebrations have become defunct")
            .attribute("celebrationIds", celebrations.stream().map(Celebration::getId).toList())
            .attribute("sessionEndDate", session.getSessionEndDate())
            .attribute("nextElectionDate", session.getNextElectionDate())
            .build();
    }

    private static Notification warningNotice(List<Celebration> celebrations, SessionInfo session) {
        DonorInfoSnapshot donor = celebrations.get(0).getDonorInfo();
        return Notification.builder()
            .type(NotificationType.DEFUNCT_WARNING)
            .donorId(celebrations.get(0).getDonorId())
            .recipientEmail(donor != null ? donor.getEmail() : null)
            .subject("The congressional session is ending soon")
            .attribute("activeCelebrations", celebrations.size())
            .attribute("sessionEndDate", session.getSessionEndDate())
            .build();
    }
}
