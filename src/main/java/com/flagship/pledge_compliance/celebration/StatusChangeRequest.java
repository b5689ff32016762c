package com.flagship.pledge_compliance.celebration;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A requested status transition with the context recorded in the ledger.
 */
@Value
@Builder
public class StatusChangeRequest {
    CelebrationStatus targetStatus;
    String reason;
    StatusActor actor;
    Map<String, Object> metadata;
}
