package com.flagship.pledge_compliance.celebration;

import lombok.Value;

/**
 * Caller context recorded with a status change. Supplied by the caller as-is.
 */
@Value
public class AuditTrail {
    public static final AuditTrail EMPTY = new AuditTrail(null, null, null);

    String ipAddress;
    String userAgent;
    String sessionId;
}
