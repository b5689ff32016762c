package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.compliance.dto.LimitCheckResponse;
import com.flagship.pledge_compliance.compliance.dto.LimitSummaryResponse;
import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only limit projections for a donor. Nothing here is trusted for enforcement.
 */
@Service
@RequiredArgsConstructor
public class LimitQueryService {

    private final DonorService donorService;
    private final PledgeHistoryStore historyStore;
    private final ComplianceService complianceService;
    private final LimitEngine limitEngine;

    @Transactional(readOnly = true)
    public LimitSummaryResponse limits(UUID donorId, String recipientId, BigDecimal stagedAmount) {
        Donor donor = donorService.getDonor(donorId);
        ComplianceTier tier = donorService.effectiveTier(donor);
        List<PledgeRecord> history = historyStore.findByDonor(donorId);

        LimitSummary summary = complianceService.limitSummary(tier, recipientId, history);
        return LimitSummaryResponse.builder()
                .summary(summary)
                .suggestedAmounts(limitEngine.suggestedAmounts(tier, summary.getRemainingLimit()))
                .clampedDonation(limitEngine.clampStagedDonation(stagedAmount, summary.getRemainingLimit()))
                .build();
    }

    @Transactional(readOnly = true)
    public LimitCheckResponse check(UUID donorId, BigDecimal amount, String recipientId) {
        Donor donor = donorService.getDonor(donorId);
        ComplianceTier tier = donorService.effectiveTier(donor);
        Optional<LimitInfo> violation = complianceService.previewDonation(
                tier, amount, recipientId, historyStore.findByDonor(donorId));
        return new LimitCheckResponse(violation.isPresent(), violation.orElse(null));
    }
}
