package com.flagship.pledge_compliance.celebration.event;

import com.flagship.pledge_compliance.celebration.Celebration;
import com.flagship.pledge_compliance.celebration.StatusLedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every applied status transition.
 */
@Value
public class CelebrationStatusChangedEvent implements CelebrationEvent {
    public static final String EVENT_TYPE = "CelebrationStatusChanged";

    UUID eventId;
    UUID celebrationId;
    UUID donorId;
    String donorEmail;
    UUID statusChangeId;
    String previousStatus;
    String newStatus;
    String reason;
    String triggeredBy;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CelebrationStatusChangedEvent from(Celebration celebration) {
        StatusLedgerEntry entry = celebration.latestEntry();
        return new CelebrationStatusChangedEvent(
            UUID.randomUUID(),
            celebration.getId(),
            celebration.getDonorId(),
            celebration.getDonorInfo() != null ? celebration.getDonorInfo().getEmail() : null,
            entry.getStatusChangeId(),
            entry.getPreviousStatus() != null ? entry.getPreviousStatus().getValue() : "none",
            entry.getNewStatus().getValue(),
            entry.getReason(),
            entry.getTriggeredBy().getValue(),
            entry.getChangedAt()
        );
    }
}
