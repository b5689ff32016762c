package com.flagship.pledge_compliance.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.celebration.Celebration;
import com.flagship.pledge_compliance.celebration.ValidationFlags;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Celebration as returned by the API, including the legacy status flags.
 */
@Value
@Builder
public class CelebrationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("donor_id")
    UUID donorId;

    @JsonProperty("politician_id")
    String politicianId;

    @JsonProperty("bill_id")
    String billId;

    @JsonProperty("donation_amount")
    BigDecimal donationAmount;

    @JsonProperty("tip_amount")
    BigDecimal tipAmount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("current_status")
    String currentStatus;

    @JsonProperty("resolved")
    boolean resolved;

    @JsonProperty("paused")
    boolean paused;

    @JsonProperty("defunct")
    boolean defunct;

    @JsonProperty("defunct_date")
    Instant defunctDate;

    @JsonProperty("defunct_reason")
    String defunctReason;

    @JsonProperty("compliance_tier")
    String complianceTier;

    @JsonProperty("validation_flags")
    ValidationFlags validationFlags;

    @JsonProperty("ledger_entries")
    int ledgerEntries;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CelebrationResponse from(Celebration celebration) {
        return CelebrationResponse.builder()
                .id(celebration.getId())
                .donorId(celebration.getDonorId())
                .politicianId(celebration.getPoliticianId())
                .billId(celebration.getBillId())
                .donationAmount(celebration.getDonationAmount())
                .tipAmount(celebration.getTipAmount())
                .fee(celebration.getFee())
                .currentStatus(celebration.getCurrentStatus().getValue())
                .resolved(celebration.isResolved())
                .paused(celebration.isPaused())
                .defunct(celebration.isDefunct())
                .defunctDate(celebration.getDefunctDate())
                .defunctReason(celebration.getDefunctReason())
                .complianceTier(celebration.getDonorInfo().getCompliance())
                .validationFlags(celebration.getDonorInfo().getValidationFlags())
                .ledgerEntries(celebration.getStatusLedger().size())
                .createdAt(celebration.getCreatedAt())
                .updatedAt(celebration.getUpdatedAt())
                .build();
    }
}
