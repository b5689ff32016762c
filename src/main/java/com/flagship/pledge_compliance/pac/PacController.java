package com.flagship.pledge_compliance.pac;

import com.flagship.pledge_compliance.compliance.PledgeHistoryStore;
import com.flagship.pledge_compliance.donor.Donor;
import com.flagship.pledge_compliance.donor.DonorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class PacController {

    private final DonorService donorService;
    private final PledgeHistoryStore historyStore;
    private final PacLimitTracker pacLimitTracker;
    private final Clock clock;

    /**
     * PAC tip usage for the current calendar year.
     */
    @GetMapping("/api/donors/{donorId}/pac")
    @Transactional(readOnly = true)
    public ResponseEntity<PacLimitSummary> getPacSummary(@PathVariable("donorId") UUID donorId) {
        Donor donor = donorService.getDonor(donorId);
        return ResponseEntity.ok(pacLimitTracker.summarize(
                historyStore.findByDonor(donorId), clock.instant(), donor.isTipLimitReached()));
    }
}
