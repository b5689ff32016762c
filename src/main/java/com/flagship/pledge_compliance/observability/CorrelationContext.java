package com.flagship.pledge_compliance.observability;

import java.util.UUID;

/**
 * Thread-local holder for the request correlation ID.
 *
 * The ID comes from the X-Correlation-ID header (or is generated), is copied
 * into the MDC for every log line of the request, and is echoed back on the
 * response so a client can quote it when reporting a rejected pledge.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CELEBRATION_ID_MDC_KEY = "celebrationId";
    public static final String DONOR_ID_MDC_KEY = "donorId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, generating one if the thread has none.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readable log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
