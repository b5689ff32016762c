package com.flagship.pledge_compliance.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily session check. Off unless {@code jobs.session-check.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "jobs.session-check.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SessionCheckJob {

    private final DefunctCelebrationService defunctCelebrationService;

    @Scheduled(cron = "${jobs.session-check.cron:0 0 6 * * *}", zone = "${compliance.timezone:America/New_York}")
    public void checkSession() {
        try {
            SessionCheckResult result = defunctCelebrationService.checkAndConvertIfNeeded();
            log.info("Scheduled session check finished: {}", result.getAction().getValue());
        } catch (Exception e) {
            log.error("Scheduled session check failed: {}", e.getMessage(), e);
        }
    }
}
