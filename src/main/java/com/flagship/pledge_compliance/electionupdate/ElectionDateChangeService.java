package com.flagship.pledge_compliance.electionupdate;

import com.flagship.pledge_compliance.celebration.CelebrationPersistenceService;
import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.compliance.LimitEngine;
import com.flagship.pledge_compliance.compliance.PledgeRecord;
import com.flagship.pledge_compliance.compliance.ResetType;
import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorService;
import com.flagship.pledge_compliance.election.ElectionCycle;
import com.flagship.pledge_compliance.election.ElectionCycleCalculator;
import com.flagship.pledge_compliance.election.ElectionCycleService;
import com.flagship.pledge_compliance.election.ElectionDateProvider;
import com.flagship.pledge_compliance.election.ElectionDates;
import com.flagship.pledge_compliance.election.PoliticianDirectory;
import com.flagship.pledge_compliance.notification.Notification;
import com.flagship.pledge_compliance.notification.NotificationDispatcher;
import com.flagship.pledge_compliance.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Tells donors when a state's election calendar moves.
 *
 * Two audiences:
 * 1. Donors with active pledges to the state's recipients. Only tiers whose
 *    limits reset per election are affected; they hear about it when their
 *    remaining room or the calendar itself changed.
 * 2. Donors who live in the state but hold no such pledge get a plain notice.
 *
 * A failure for one donor is logged and counted; the rest are still notified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElectionDateChangeService {

    private final ElectionDateProvider dateProvider;
    private final ElectionCycleService electionCycleService;
    private final ElectionCycleCalculator cycleCalculator;
    private final PoliticianDirectory politicianDirectory;
    private final CelebrationPersistenceService persistenceService;
    private final DonorService donorService;
    private final LimitEngine limitEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    /**
     * Publishes new dates for a state and notifies affected donors if anything moved.
     * The previous calendar is whatever was in effect, fallback dates included.
     */
    public ElectionDateChangeSummary updateElectionDates(ElectionDates newDates) {
        String state = newDates.getState();
        ElectionDates previous = electionCycleService.resolveDates(state, clock.instant());
        dateProvider.saveElectionDates(newDates);

        if (!datesChanged(previous, newDates)) {
            log.info("Election dates for {} unchanged, no notifications sent", state);
            return ElectionDateChangeSummary.unchanged(state);
        }
        return handleElectionDateChange(state, previous, newDates);
    }

    public ElectionDateChangeSummary handleElectionDateChange(String state, ElectionDates oldDates,
                                                              ElectionDates newDates) {
        log.info("Processing election date change for {}", state);
        Instant now = clock.instant();
        Set<String> recipients = new LinkedHashSet<>(politicianDirectory.findPledgeableIdsByState(state));
        List<UUID> pledgeDonors = persistenceService.findDonorsWithActivePledgesTo(recipients);

        int pledgeSent = 0;
        int failed = 0;
        for (UUID donorId : pledgeDonors) {
            try {
                Donor donor = donorService.getDonor(donorId);
                if (!hasEmail(donor)) {
                    continue;
                }
                ElectionDateImpact impact = calculateImpact(donor, recipients, oldDates, newDates, now);
                if (!impact.isHasImpact()) {
                    log.debug("No impact for donor {}: {}", donorId, impact.getDescription());
                    continue;
                }
                if (notificationDispatcher.dispatch(changeNotice(donor, state, oldDates, newDates, impact))) {
                    pledgeSent++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to notify donor {} of the {} date change: {}", donorId, state, e.getMessage(), e);
            }
        }

        Set<UUID> alreadyConsidered = new HashSet<>(pledgeDonors);
        List<Donor> residentsOnly = donorService.findResidentsOf(state).stream()
            .filter(donor -> !alreadyConsidered.contains(donor.getId()))
            .filter(ElectionDateChangeService::hasEmail)
            .toList();
        int residentSent = 0;
        for (Donor donor : residentsOnly) {
            if (notificationDispatcher.dispatch(residentNotice(donor, state, oldDates, newDates))) {
                residentSent++;
            } else {
                failed++;
            }
        }

        ElectionDateChangeSummary summary = new ElectionDateChangeSummary(
            state, true, pledgeDonors.size(), residentsOnly.size(), pledgeSent, residentSent, failed);
        log.info("Election date change for {}: {} pledge donor(s), {} resident(s), {} notification(s) sent, {} failed",
            state, pledgeDonors.size(), residentsOnly.size(), summary.getTotalNotificationsSent(), failed);
        return summary;
    }

    /**
     * Compares the donor's remaining per-election room under both calendars.
     *
     * @param stateRecipients Recipients standing for the state
     */
    public ElectionDateImpact calculateImpact(Donor donor, Set<String> stateRecipients,
                                              ElectionDates oldDates, ElectionDates newDates, Instant now) {
        ComplianceTier tier = donorService.effectiveTier(donor);
        if (limitEngine.ruleFor(tier).getResetType() != ResetType.ELECTION_CYCLE) {
            return ElectionDateImpact.none("Tier " + tier.getValue() + " has no election-cycle limits");
        }

        List<PledgeRecord> history = persistenceService.findByDonor(donor.getId());
        List<String> recipients = history.stream()
            .filter(pledge -> !pledge.isDefunct() && !pledge.isPaused() && !pledge.isResolved())
            .map(PledgeRecord::getRecipientId)
            .filter(stateRecipients::contains)
            .distinct()
            .toList();

        BigDecimal oldLimit = tightestRemaining(tier, history, recipients, cycleCalculator.calculate(oldDates, now), now);
        BigDecimal newLimit = tightestRemaining(tier, history, recipients, cycleCalculator.calculate(newDates, now), now);

        int direction = newLimit.compareTo(oldLimit);
        if (direction != 0) {
            return new ElectionDateImpact(true, oldLimit, newLimit, true,
                direction > 0 ? ElectionDateImpact.LIMIT_INCREASED : ElectionDateImpact.LIMIT_DECREASED);
        }
        if (datesChanged(oldDates, newDates)) {
            return new ElectionDateImpact(true, oldLimit, newLimit, false, ElectionDateImpact.TIMELINE_CHANGED);
        }
        return new ElectionDateImpact(false, oldLimit, newLimit, false, "Limits and timeline unchanged");
    }

    private BigDecimal tightestRemaining(ComplianceTier tier, List<PledgeRecord> history, List<String> recipients,
                                         ElectionCycle cycle, Instant now) {
        if (recipients.isEmpty()) {
            return remaining(tier, history, null, cycle, now);
        }
        return recipients.stream()
            .map(recipient -> remaining(tier, history, recipient, cycle, now))
            .min(BigDecimal::compareTo)
            .orElseThrow();
    }

    private BigDecimal remaining(ComplianceTier tier, List<PledgeRecord> history, String recipient,
                                 ElectionCycle cycle, Instant now) {
        return limitEngine.summarize(tier, limitEngine.aggregate(history, recipient, cycle, now), cycle, now)
            .getRemainingLimit();
    }

    /**
     * A date appearing, disappearing or moving counts as a change.
     */
    static boolean datesChanged(ElectionDates oldDates, ElectionDates newDates) {
        return !Objects.equals(oldDates.getPrimary(), newDates.getPrimary())
            || !Objects.equals(oldDates.getGeneral(), newDates.getGeneral())
            || !Objects.equals(oldDates.getRunoff(), newDates.getRunoff())
            || !Objects.equals(oldDates.getSpecial(), newDates.getSpecial());
    }

    private static boolean hasEmail(Donor donor) {
        return donor.getEmail() != null && !donor.getEmail().isBlank();
    }

    private static Notification changeNotice(Donor donor, String state, ElectionDates oldDates,
                                             ElectionDates newDates, ElectionDateImpact impact) {
        return Notification.builder()
            .type(NotificationType.ELECTION_DATE_CHANGED)
            .donorId(donor.getId())
            .recipientEmail(donor.getEmail())
            .subject("Election dates changed in " + state)
            .attribute("state", state)
            .attribute("firstName", Objects.toString(donor.getFirstName(), ""))
            .attribute("oldLimit", impact.getOldLimit())
            .attribute("newLimit", impact.getNewLimit())
            .attribute("oldPrimaryDate", dateOrNone(oldDates.getPrimary()))
            .attribute("newPrimaryDate", dateOrNone(newDates.getPrimary()))
            .attribute("oldGeneralDate", dateOrNone(oldDates.getGeneral()))
            .attribute("newGeneralDate", dateOrNone(newDates.getGeneral()))
            .attribute("impactDescription", impact.getDescription())
            .build();
    }

    private static Notification residentNotice(Donor donor, String state, ElectionDates oldDates,
                                               ElectionDates newDates) {
        return Notification.builder()
            .type(NotificationType.ELECTION_DATE_NOTICE)
            .donorId(donor.getId())
            .recipientEmail(donor.getEmail())
            .subject("Election dates changed in " + state)
            .attribute("state", state)
            .attribute("firstName", Objects.toString(donor.getFirstName(), ""))
            .attribute("oldPrimaryDate", dateOrNone(oldDates.getPrimary()))
            .attribute("newPrimaryDate", dateOrNone(newDates.getPrimary()))
            .attribute("oldGeneralDate", dateOrNone(oldDates.getGeneral()))
            .attribute("newGeneralDate", dateOrNone(newDates.getGeneral()))
            .build();
    }

    private static String dateOrNone(LocalDate date) {
        return date != null ? date.toString() : "none";
    }
}
