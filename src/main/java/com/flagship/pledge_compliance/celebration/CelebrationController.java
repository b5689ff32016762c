package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.celebration.dto.CelebrationResponse;
import com.flagship.pledge_compliance.celebration.dto.CreateCelebrationRequest;
import com.flagship.pledge_compliance.celebration.dto.StatusHistoryResponse;
import com.flagship.pledge_compliance.celebration.dto.StatusUpdateRequest;
import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import com.flagship.pledge_compliance.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST controller for pledges and their status lifecycle.
 *
 * - POST /api/celebrations requires an Idempotency-Key header; a replay returns
 *   the original pledge with 200 instead of 201 and counts nothing twice
 * - Status endpoints go through the transition table; a disallowed change is 409
 */
@RestController
@RequestMapping("/api/celebrations")
@RequiredArgsConstructor
@Slf4j
public class CelebrationController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String SESSION_ID_HEADER = "X-Session-Id";

    private final CelebrationService celebrationService;
    private final CelebrationStatusService statusService;
    private final ComplianceMetrics metrics;

    @PostMapping
    public ResponseEntity<CelebrationResponse> createCelebration(
            @Valid @RequestBody CreateCelebrationRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            HttpServletRequest httpRequest) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DONOR_ID_MDC_KEY, request.getDonorId().toString());
        log.info("Received celebration request: idempotencyKey={}, donation={}, tip={}, politician={}",
                idempotencyKey, request.getDonation(), request.getTip(), request.getPoliticianId());

        try {
            CreationResult result = celebrationService.createCelebration(
                    request.toCommand(), idempotencyKey, auditTrail(httpRequest));
            MDC.put(CorrelationContext.CELEBRATION_ID_MDC_KEY, result.getCelebration().getId().toString());

            HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
            return ResponseEntity.status(status).body(CelebrationResponse.from(result.getCelebration()));
        } finally {
            metrics.recordLatency("create", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.CELEBRATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.DONOR_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<CelebrationResponse> getCelebration(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CelebrationResponse.from(statusService.getCelebration(id)));
    }

    /**
     * Generic transition to the status named in the body.
     */
    @PostMapping("/{id}/status")
    public ResponseEntity<CelebrationResponse> changeStatus(@PathVariable("id") UUID id,
                                                            @Valid @RequestBody StatusUpdateRequest request,
                                                            HttpServletRequest httpRequest) {
        if (request.getStatus() == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        CelebrationStatus target = CelebrationStatus.fromValue(request.getStatus());
        if (target == CelebrationStatus.DEFUNCT) {
            throw new IllegalArgumentException("Celebrations become defunct only when the legislative session ends");
        }
        StatusActor actor = actor(request, httpRequest);
        return withCelebrationContext(id, () -> statusService.changeStatus(id, StatusChangeRequest.builder()
                .targetStatus(target)
                .reason(request.getReason())
                .actor(actor != null ? actor : StatusActor.system("System"))
                .metadata(request.getDetails() != null ? request.getDetails() : Map.of())
                .build()));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<CelebrationResponse> pause(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody StatusUpdateRequest request,
                                                     HttpServletRequest httpRequest) {
        return withCelebrationContext(id, () ->
                statusService.pause(id, request.getReason(), request.getDetails(), actor(request, httpRequest)));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<CelebrationResponse> activate(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody StatusUpdateRequest request,
                                                        HttpServletRequest httpRequest) {
        return withCelebrationContext(id, () ->
                statusService.activate(id, request.getReason(), actor(request, httpRequest)));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<CelebrationResponse> resolve(@PathVariable("id") UUID id,
                                                       @Valid @RequestBody StatusUpdateRequest request,
                                                       HttpServletRequest httpRequest) {
        return withCelebrationContext(id, () ->
                statusService.resolve(id, request.getReason(), request.getDetails(), actor(request, httpRequest)));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<StatusHistoryResponse> getStatusHistory(
            @PathVariable("id") UUID id,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        return ResponseEntity.ok(StatusHistoryResponse.from(statusService.getStatusHistory(id, limit)));
    }

    @GetMapping("/{id}/duration")
    public ResponseEntity<StatusHistoryResponse.StatusDurationResponse> getStatusDuration(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(StatusHistoryResponse.StatusDurationResponse.from(
                statusService.calculateStatusDuration(id)));
    }

    private ResponseEntity<CelebrationResponse> withCelebrationContext(UUID id,
                                                                       Supplier<Celebration> action) {
        MDC.put(CorrelationContext.CELEBRATION_ID_MDC_KEY, id.toString());
        try {
            return ResponseEntity.ok(CelebrationResponse.from(action.get()));
        } finally {
            MDC.remove(CorrelationContext.CELEBRATION_ID_MDC_KEY);
        }
    }

    /**
     * A user actor when the body names one, otherwise null so the service applies its system default.
     */
    private StatusActor actor(StatusUpdateRequest request, HttpServletRequest httpRequest) {
        if (request.getActorId() == null || request.getActorId().isBlank()) {
            return null;
        }
        return StatusActor.user(request.getActorId(), request.getActorName(), auditTrail(httpRequest));
    }

    private static AuditTrail auditTrail(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        String ip = forwarded != null && !forwarded.isBlank()
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        return new AuditTrail(ip, request.getHeader("User-Agent"), request.getHeader(SESSION_ID_HEADER));
    }
}
