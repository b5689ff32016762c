package com.flagship.pledge_compliance.observability;

import com.flagship.pledge_compliance.celebration.CelebrationRepository;
import com.flagship.pledge_compliance.celebration.CelebrationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Refreshes database-backed gauges off the scrape path: the outbox backlog
 * and the number of pledges in each status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ComplianceMetrics complianceMetrics;
    private final CelebrationRepository celebrationRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshStatusCounts() {
        try {
            for (CelebrationStatus status : CelebrationStatus.values()) {
                complianceMetrics.updateStatusCount(status.getValue(), celebrationRepository.countByCurrentStatus(status));
            }
        } catch (Exception e) {
            log.warn("Failed to refresh celebration status gauges: {}", e.getMessage());
        }
    }
}
