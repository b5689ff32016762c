package com.flagship.pledge_compliance.celebration.event;

import com.flagship.pledge_compliance.celebration.Celebration;
import com.flagship.pledge_compliance.celebration.DonorInfoSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pledge passes compliance and is stored as active.
 * Drives the donor receipt.
 */
@Value
public class CelebrationCreatedEvent implements CelebrationEvent {
    public static final String EVENT_TYPE = "CelebrationCreated";

    UUID eventId;
    UUID celebrationId;
    UUID donorId;
    String donorEmail;
    String donorName;
    String politicianId;
    String billId;
    BigDecimal donationAmount;
    BigDecimal tipAmount;
    BigDecimal fee;
    String complianceTier;
    boolean tipTruncated;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CelebrationCreatedEvent from(Celebration celebration, boolean tipTruncated) {
        DonorInfoSnapshot info = celebration.getDonorInfo();
        return new CelebrationCreatedEvent(
            UUID.randomUUID(),
            celebration.getId(),
            celebration.getDonorId(),
            info.getEmail(),
            (nullToEmpty(info.getFirstName()) + " " + nullToEmpty(info.getLastName())).trim(),
            celebration.getPoliticianId(),
            celebration.getBillId(),
            celebration.getDonationAmount(),
            celebration.getTipAmount(),
            celebration.getFee(),
            info.getCompliance(),
            tipTruncated,
            celebration.getCreatedAt()
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
