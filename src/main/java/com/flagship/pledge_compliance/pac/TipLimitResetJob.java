package com.flagship.pledge_compliance.pac;

import com.flagship.pledge_compliance.donor.DonorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Clears every donor's sticky tipLimitReached flag at the calendar-year boundary.
 *
 * Fires at midnight January 1 Eastern. Missing a run does not loosen the cap:
 * the tracker only counts this year's tips, so the flag is informational between
 * the boundary and the next run.
 */
@Component
@ConditionalOnProperty(name = "jobs.tip-limit-reset.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TipLimitResetJob {

    private final DonorService donorService;

    @Scheduled(cron = "0 0 0 1 1 *", zone = "${compliance.timezone:America/New_York}")
    public void resetTipLimits() {
        try {
            int reset = donorService.resetTipLimitReached();
            log.info("Annual PAC reset cleared tipLimitReached for {} donor(s)", reset);
        } catch (Exception e) {
            log.error("Annual PAC reset failed: {}", e.getMessage(), e);
        }
    }
}
