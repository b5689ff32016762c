package com.flagship.pledge_compliance.celebration.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pledge's tip brings the donor's yearly PAC total to the limit.
 */
@Value
public class TipLimitReachedEvent implements CelebrationEvent {
    public static final String EVENT_TYPE = "TipLimitReached";

    UUID eventId;
    UUID celebrationId;
    UUID donorId;
    String donorEmail;
    BigDecimal pacLimit;
    BigDecimal pacTotal;
    boolean tipTruncated;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
