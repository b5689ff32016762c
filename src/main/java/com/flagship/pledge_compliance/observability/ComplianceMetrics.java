package com.flagship.pledge_compliance.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the compliance engine and pledge lifecycle.
 *
 * Metrics exposed:
 * - celebrations.created: pledges created, tagged by tier and outcome
 * - compliance.rejections: rejected donations, tagged by limit type
 * - compliance.legacy_fallback: enhanced checks that fell back to the legacy rules
 * - compliance.degraded_data: unknown tiers and missing election dates
 * - celebrations.transitions: applied status transitions, tagged by target status
 * - pac.tip_truncated / pac.limit_reached: PAC tip outcomes
 * - notifications.failed: swallowed notification sink failures
 * - idempotency.cache: replay hits and misses
 * - celebrations.current: pledges per status, refreshed by {@link MetricsScheduler}
 */
@Component
public class ComplianceMetrics {

    private final MeterRegistry registry;
    private final Map<String, AtomicLong> statusCounts = new ConcurrentHashMap<>();

    public ComplianceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCelebrationCreated(String tier, String outcome) {
        registry.counter("celebrations.created",
                "tier", sanitizeTag(tier),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordComplianceRejection(String limitType) {
        registry.counter("compliance.rejections", "limit_type", sanitizeTag(limitType)).increment();
    }

    public void recordLegacyFallback() {
        registry.counter("compliance.legacy_fallback").increment();
    }

    /**
     * Records a degraded input the engine recovered from, such as an unknown
     * tier name or missing election dates.
     */
    public void recordDegradedData(String kind) {
        registry.counter("compliance.degraded_data", "kind", sanitizeTag(kind)).increment();
    }

    public void recordTransition(String targetStatus, String trigger) {
        registry.counter("celebrations.transitions",
                "status", sanitizeTag(targetStatus),
                "trigger", sanitizeTag(trigger)
        ).increment();
    }

    public void recordTipTruncated() {
        registry.counter("pac.tip_truncated").increment();
    }

    public void recordPacLimitReached() {
        registry.counter("pac.limit_reached").increment();
    }

    public void recordNotificationFailure(String type) {
        registry.counter("notifications.failed", "type", sanitizeTag(type)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("celebrations.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void updateStatusCount(String status, long count) {
        statusCounts.computeIfAbsent(status, s -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder("celebrations.current", holder, AtomicLong::get)
                    .description("Celebrations currently in each status")
                    .tag("status", sanitizeTag(s))
                    .register(registry);
            return holder;
        }).set(count);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
