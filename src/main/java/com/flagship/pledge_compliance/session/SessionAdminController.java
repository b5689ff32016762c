package com.flagship.pledge_compliance.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/session")
@RequiredArgsConstructor
@Slf4j
public class SessionAdminController {

    private final LegislativeSessionSignal sessionSignal;
    private final DefunctCelebrationService defunctCelebrationService;

    @GetMapping
    public ResponseEntity<SessionInfo> getSession() {
        return ResponseEntity.ok(sessionSignal.getSessionInfo());
    }

    /**
     * Runs the session check on demand.
     */
    @PostMapping("/check")
    public ResponseEntity<SessionCheckResult> check() {
        log.info("Manual session check requested");
        return ResponseEntity.ok(defunctCelebrationService.checkAndConvertIfNeeded());
    }
}
