package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.celebration.event.CelebrationCreatedEvent;
import com.flagship.pledge_compliance.celebration.event.CelebrationEvent;
import com.flagship.pledge_compliance.celebration.event.TipLimitReachedEvent;
import com.flagship.pledge_compliance.compliance.AnnualResetBoundary;
import com.flagship.pledge_compliance.compliance.ComplianceTierResolver;
import com.flagship.pledge_compliance.compliance.ComplianceDecision;
import com.flagship.pledge_compliance.compliance.ComplianceService;
import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.compliance.LimitInfo;
import com.flagship.pledge_compliance.compliance.LimitType;
import com.flagship.pledge_compliance.compliance.PledgeRecord;
import com.flagship.pledge_compliance.compliance.ValidationMode;
import com.flagship.pledge_compliance.election.ElectionCycle;
import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorEntity;
import com.flagship.pledge_compliance.donor.DonorRepository;
import com.flagship.pledge_compliance.donor.DonorService;
import com.flagship.pledge_compliance.exception.ComplianceViolationException;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import com.flagship.pledge_compliance.outbox.OutboxService;
import com.flagship.pledge_compliance.pac.PacLimitTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CelebrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-09-15T12:00:00Z");
    private static final ZoneId EASTERN = ZoneId.of("America/New_York");

    @Mock
    private CelebrationPersistenceService persistenceService;
    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private DonorService donorService;
    @Mock
    private ComplianceService complianceService;
    @Mock
    private OutboxService outboxService;
    @Mock
    private DonorRepository donorRepository;

    private CelebrationService service;

    private final Donor donor = Donor.builder()
            .id(UUID.randomUUID())
            .email("jane@example.com")
            .firstName("Jane")
            .lastName("Doe")
            .address("12 Main St")
            .city("Austin")
            .state("TX")
            .zip("78701")
            .country("US")
            .employed(true)
            .occupation("Engineer")
            .employer("Acme")
            .complianceTier("verified")
            .build();

    @BeforeEach
    void setUp() {
        service = serviceWith(donorService);
    }

    private CelebrationService serviceWith(DonorService donors) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new CelebrationService(
                persistenceService,
                idempotencyService,
                donors,
                complianceService,
                new PacLimitTracker(new BigDecimal("5000"), new AnnualResetBoundary(EASTERN)),
                new FeeCalculator(new BigDecimal("0.029"), new BigDecimal("0.30")),
                new DonorInfoValidator(clock),
                outboxService,
                new ComplianceMetrics(new SimpleMeterRegistry()),
                clock);
    }

    @Test
    @DisplayName("Compliance violation aborts creation with nothing written")
    void violationWritesNothing() {
        LimitInfo annualCap = LimitInfo.builder()
                .limitType(LimitType.ANNUAL_CAP)
                .amount(new BigDecimal("200"))
                .scope("all recipients")
                .message("Annual limit of $200 reached")
                .build();
        stubDonor(List.of());
        when(complianceService.checkDonation(eq(ComplianceTier.UNVERIFIED), any(), eq("pol-a"), any()))
                .thenReturn(ComplianceDecision.builder()
                        .compliant(false)
                        .tier(ComplianceTier.UNVERIFIED)
                        .violation(annualCap)
                        .mode(ValidationMode.ENHANCED)
                        .build());

        assertThatThrownBy(() -> service.createCelebration(command(new BigDecimal("30"), BigDecimal.ZERO),
                "key-1", AuditTrail.EMPTY))
                .isInstanceOf(ComplianceViolationException.class)
                .extracting("limitInfo").isEqualTo(annualCap);

        verify(persistenceService, never()).create(any(), anyString());
        verify(outboxService, never()).saveEvent(any());
        verify(donorService, never()).markTipLimitReached(any());
    }

    @Test
    @DisplayName("A reused idempotency key returns the stored celebration without a second write")
    void replay() {
        Celebration existing = Celebration.create(UUID.randomUUID(), donor.getId(), "pol-a", "hr-1", "TX",
                new BigDecimal("30"), BigDecimal.ZERO, new BigDecimal("1.17"), null, AuditTrail.EMPTY, NOW);
        when(idempotencyService.findCelebrationId("key-1")).thenReturn(Optional.of(existing.getId()));
        when(persistenceService.findById(existing.getId())).thenReturn(Optional.of(existing));

        CreationResult result = service.createCelebration(command(new BigDecimal("30"), BigDecimal.ZERO),
                "key-1", AuditTrail.EMPTY);

        assertThat(result.isReplayed()).isTrue();
        assertThat(result.getCelebration()).isSameAs(existing);
        verify(donorService, never()).lockDonor(any());
        verify(persistenceService, never()).create(any(), anyString());
    }

    @Test
    @DisplayName("Compliant pledge is stored with its fee and creation event")
    void created() {
        stubDonor(List.of());
        stubCompliant();

        CreationResult result = service.createCelebration(command(new BigDecimal("100"), new BigDecimal("5")),
                "key-2", new AuditTrail("203.0.113.7", "JUnit", null));

        Celebration celebration = result.getCelebration();
        assertThat(result.isReplayed()).isFalse();
        assertThat(celebration.getFee()).isEqualByComparingTo("3.20");
        assertThat(celebration.getTipAmount()).isEqualByComparingTo("5");
        assertThat(celebration.getDonorInfo().getCompliance()).isEqualTo("unverified");
        assertThat(celebration.latestEntry().getAuditTrail().getIpAddress()).isEqualTo("203.0.113.7");
        verify(persistenceService).create(celebration, "key-2");
        verify(outboxService).saveEvent(any(CelebrationCreatedEvent.class));
        verify(idempotencyService).rememberAfterCommit("key-2", celebration.getId());
        verify(donorService, never()).markTipLimitReached(any());
    }

    @Test
    @DisplayName("Tip past the PAC limit is truncated to zero and the donor flag is set")
    void tipTruncated() {
        PledgeRecord earlier = PledgeRecord.builder()
                .celebrationId(UUID.randomUUID())
                .donationAmount(new BigDecimal("50"))
                .tipAmount(new BigDecimal("4990"))
                .recipientId("pol-b")
                .createdAt(Instant.parse("2026-02-01T12:00:00Z"))
                .build();
        stubDonor(List.of(earlier));
        stubCompliant();

        CreationResult result = service.createCelebration(command(new BigDecimal("20"), new BigDecimal("20")),
                "key-3", AuditTrail.EMPTY);

        assertThat(result.getCelebration().getTipAmount()).isEqualByComparingTo("0");
        verify(donorService).markTipLimitReached(donor.getId());

        ArgumentCaptor<CelebrationEvent> events = ArgumentCaptor.forClass(CelebrationEvent.class);
        verify(outboxService, times(2)).saveEvent(events.capture());
        assertThat(events.getAllValues()).extracting(CelebrationEvent::getEventType)
                .containsExactly(CelebrationCreatedEvent.EVENT_TYPE, TipLimitReachedEvent.EVENT_TYPE);
    }

    @Test
    @DisplayName("Limits are enforced at the donor's stored tier")
    void storedTierIsEnforced() {
        Donor unverified = donor.toBuilder().complianceTier("unverified").build();
        DonorService realDonors = new DonorService(donorRepository,
                new ComplianceTierResolver(new ComplianceMetrics(new SimpleMeterRegistry())));
        DonorEntity stored = mock(DonorEntity.class);
        when(stored.toDomain()).thenReturn(unverified);
        when(donorRepository.findByIdForUpdate(unverified.getId())).thenReturn(Optional.of(stored));
        when(persistenceService.findByDonor(unverified.getId())).thenReturn(List.of());
        stubCompliant();

        CreationResult result = serviceWith(realDonors).createCelebration(
                command(new BigDecimal("40"), BigDecimal.ZERO), "key-4", AuditTrail.EMPTY);

        verify(complianceService).checkDonation(eq(ComplianceTier.UNVERIFIED), any(), eq("pol-a"), any());
        assertThat(result.getCelebration().getDonorInfo().getCompliance()).isEqualTo("unverified");
    }

    @Test
    @DisplayName("The pledge records the recipient state the compliance check resolved")
    void recipientStateFromDecision() {
        stubDonor(List.of());
        when(complianceService.checkDonation(any(), any(), any(), any()))
                .thenReturn(ComplianceDecision.builder()
                        .compliant(true)
                        .tier(ComplianceTier.UNVERIFIED)
                        .electionCycle(ElectionCycle.builder().state("OH").build())
                        .mode(ValidationMode.ENHANCED)
                        .build());

        CreationResult result = service.createCelebration(command(new BigDecimal("25"), BigDecimal.ZERO),
                "key-5", AuditTrail.EMPTY);

        assertThat(result.getCelebration().getState()).isEqualTo("OH");
    }

    private void stubDonor(List<PledgeRecord> history) {
        when(donorService.lockDonor(donor.getId())).thenReturn(donor);
        when(donorService.effectiveTier(donor)).thenReturn(ComplianceTier.UNVERIFIED);
        when(persistenceService.findByDonor(donor.getId())).thenReturn(history);
    }

    private void stubCompliant() {
        when(complianceService.checkDonation(any(), any(), any(), any()))
                .thenReturn(ComplianceDecision.builder()
                        .compliant(true)
                        .tier(ComplianceTier.UNVERIFIED)
                        .mode(ValidationMode.ENHANCED)
                        .build());
    }

    private CreateCelebrationCommand command(BigDecimal donation, BigDecimal tip) {
        return CreateCelebrationCommand.builder()
                .donorId(donor.getId())
                .politicianId("pol-a")
                .billId("hr-1")
                .donation(donation)
                .tip(tip)
                .build();
    }
}
