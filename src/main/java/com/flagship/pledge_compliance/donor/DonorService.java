package com.flagship.pledge_compliance.donor;

import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.compliance.ComplianceTierResolver;
import com.flagship.pledge_compliance.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Donor registration, tier promotion and the sticky PAC flag.
 *
 * Donors start unverified and are only ever promoted: a submitted form tier
 * lower than the stored one leaves the donor unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DonorService {

    private final DonorRepository donorRepository;
    private final ComplianceTierResolver tierResolver;

    /**
     * Registers a new unverified donor.
     *
     * @throws IllegalArgumentException if the email is missing or already registered
     */
    @Transactional
    public Donor register(Donor details) {
        if (details.getEmail() == null || details.getEmail().isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        String email = details.getEmail().trim().toLowerCase(Locale.ROOT);
        if (donorRepository.existsByEmail(email)) {
            throw new IllegalArgumentException("Donor already registered: " + email);
        }

        Donor donor = details.toBuilder()
                .id(UUID.randomUUID())
                .email(email)
                .state(details.getState() != null ? details.getState().toUpperCase(Locale.ROOT) : null)
                .country(details.getCountry() != null ? details.getCountry() : "United States")
                .complianceTier(ComplianceTier.UNVERIFIED.getValue())
                .tipLimitReached(false)
                .build();

        Donor saved = donorRepository.save(DonorEntity.fromDomain(donor)).toDomain();
        log.info("Registered donor {}", saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Donor getDonor(UUID donorId) {
        return donorRepository.findById(donorId)
                .map(DonorEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Donor", donorId));
    }

    /**
     * Donors whose residential address is in the state.
     */
    @Transactional(readOnly = true)
    public List<Donor> findResidentsOf(String state) {
        return donorRepository.findByState(state.toUpperCase(Locale.ROOT)).stream()
                .map(DonorEntity::toDomain)
                .toList();
    }

    /**
     * Loads a donor under a row lock held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Donor lockDonor(UUID donorId) {
        return donorRepository.findByIdForUpdate(donorId)
                .map(DonorEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Donor", donorId));
    }

    /**
     * Tier limits are enforced at: the stored tier. A submitted form only takes
     * effect once {@link #promoteTier} has persisted it.
     */
    public ComplianceTier effectiveTier(Donor donor) {
        return tierResolver.resolve(donor.getComplianceTier());
    }

    /**
     * Promotes a donor to the higher of the stored tier and the submitted form tier.
     *
     * @return The donor after promotion (unchanged if the form tier is not higher)
     */
    @Transactional
    public Donor promoteTier(UUID donorId, String formTier) {
        DonorEntity entity = donorRepository.findByIdForUpdate(donorId)
                .orElseThrow(() -> new ResourceNotFoundException("Donor", donorId));

        ComplianceTier effective = tierResolver.effectiveTier(entity.getComplianceTier(), formTier);
        if (!effective.getValue().equals(entity.getComplianceTier())) {
            log.info("Promoting donor {} from {} to {}", donorId, entity.getComplianceTier(), effective.getValue());
            entity.promoteTier(effective.getValue());
            entity = donorRepository.save(entity);
        }
        return entity.toDomain();
    }

    /**
     * Sets the sticky PAC flag. It stays set until the annual reset.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markTipLimitReached(UUID donorId) {
        DonorEntity entity = donorRepository.findById(donorId)
                .orElseThrow(() -> new ResourceNotFoundException("Donor", donorId));
        if (!entity.isTipLimitReached()) {
            entity.markTipLimitReached();
            donorRepository.save(entity);
            log.info("Donor {} reached the PAC tip limit", donorId);
        }
    }

    /**
     * Clears the sticky PAC flag for all donors.
     *
     * @return Number of donors reset
     */
    @Transactional
    public int resetTipLimitReached() {
        return donorRepository.resetTipLimitReached();
    }
}
