package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.celebration.event.CelebrationCreatedEvent;
import com.flagship.pledge_compliance.celebration.event.TipLimitReachedEvent;
import com.flagship.pledge_compliance.compliance.ComplianceDecision;
import com.flagship.pledge_compliance.compliance.ComplianceService;
import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.compliance.PledgeRecord;
import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorService;
import com.flagship.pledge_compliance.exception.ComplianceViolationException;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import com.flagship.pledge_compliance.outbox.OutboxService;
import com.flagship.pledge_compliance.pac.PacLimitTracker;
import com.flagship.pledge_compliance.pac.TipDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates pledges.
 *
 * Flow, all in one transaction:
 * 1. Replay check on the idempotency key (again under the donor lock)
 * 2. Lock the donor row so concurrent pledges by one donor serialize
 * 3. Server-side compliance check; a violation aborts with nothing written
 * 4. PAC tip check: reach sets the sticky flag, exceed truncates the tip to zero
 * 5. Fee and donor-info snapshot
 * 6. Insert the pledge with its creation ledger entry and outbox events
 *
 * Receipts and PAC notifications go out after commit from the outbox consumer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CelebrationService {

    private final CelebrationPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final DonorService donorService;
    private final ComplianceService complianceService;
    private final PacLimitTracker pacLimitTracker;
    private final FeeCalculator feeCalculator;
    private final DonorInfoValidator donorInfoValidator;
    private final OutboxService outboxService;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    /**
     * @throws ComplianceViolationException if the donation breaks a contribution limit
     * @throws com.flagship.pledge_compliance.exception.ResourceNotFoundException if the donor does not exist
     */
    @Transactional
    public CreationResult createCelebration(CreateCelebrationCommand command, String idempotencyKey,
                                            AuditTrail auditTrail) {
        Optional<Celebration> replay = idempotencyService.findCelebrationId(idempotencyKey)
            .flatMap(persistenceService::findById);
        if (replay.isPresent()) {
            return replayed(replay.get(), idempotencyKey);
        }

        Donor donor = donorService.lockDonor(command.getDonorId());

        // A concurrent request with the same key may have committed while we waited for the lock
        replay = persistenceService.findByIdempotencyKey(idempotencyKey);
        if (replay.isPresent()) {
            return replayed(replay.get(), idempotencyKey);
        }
        metrics.recordIdempotencyMiss();

        ComplianceTier tier = donorService.effectiveTier(donor);
        List<PledgeRecord> history = persistenceService.findByDonor(donor.getId());

        ComplianceDecision decision = complianceService.checkDonation(
            tier, command.getDonation(), command.getPoliticianId(), history);
        if (!decision.isCompliant()) {
            metrics.recordCelebrationCreated(tier.getValue(), "rejected");
            throw new ComplianceViolationException(decision.firstViolation()
                .orElseThrow(() -> new IllegalStateException("Non-compliant decision without a violation")));
        }

        Instant now = clock.instant();
        BigDecimal pacTotal = pacLimitTracker.currentTotal(history, now);
        TipDecision tip = pacLimitTracker.evaluateTip(pacTotal, command.getTip());

        BigDecimal fee = feeCalculator.feeFor(command.getDonation());
        ValidationFlags flags = donorInfoValidator.validate(donor, tier);
        DonorInfoSnapshot snapshot = DonorInfoSnapshot.capture(donor, tier.getValue(), flags);

        Celebration celebration = Celebration.create(
            UUID.randomUUID(),
            donor.getId(),
            command.getPoliticianId(),
            command.getBillId(),
            recipientState(decision),
            command.getDonation(),
            tip.getAcceptedTip(),
            fee,
            snapshot,
            auditTrail,
            now
        );
        persistenceService.create(celebration, idempotencyKey);
        outboxService.saveEvent(CelebrationCreatedEvent.from(celebration, tip.isTruncated()));

        if (tip.isTruncated()) {
            log.warn("Tip of {} on celebration {} truncated to 0: PAC total {} would pass the {} limit",
                tip.getRequestedTip(), celebration.getId(), pacTotal, pacLimitTracker.getPacLimit());
            metrics.recordTipTruncated();
        }
        if (tip.isLimitReached()) {
            donorService.markTipLimitReached(donor.getId());
            outboxService.saveEvent(new TipLimitReachedEvent(
                UUID.randomUUID(),
                celebration.getId(),
                donor.getId(),
                donor.getEmail(),
                pacLimitTracker.getPacLimit(),
                tip.getNewPacTotal(),
                tip.isTruncated(),
                now
            ));
            metrics.recordPacLimitReached();
        }

        idempotencyService.rememberAfterCommit(idempotencyKey, celebration.getId());
        metrics.recordCelebrationCreated(tier.getValue(), "success");
        log.info("Created celebration {} for donor {}: donation={}, tip={}, fee={}, tier={}, validation={}",
            celebration.getId(), donor.getId(), celebration.getDonationAmount(), celebration.getTipAmount(),
            fee, tier.getValue(), decision.getMode());
        return new CreationResult(celebration, false);
    }

    private static String recipientState(ComplianceDecision decision) {
        return decision.getElectionCycle() != null ? decision.getElectionCycle().getState() : null;
    }

    private CreationResult replayed(Celebration existing, String idempotencyKey) {
        metrics.recordIdempotencyHit();
        log.info("Idempotency key {} already used, returning celebration {}", idempotencyKey, existing.getId());
        return new CreationResult(existing, true);
    }
}
