package com.flagship.pledge_compliance.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.celebration.CreateCelebrationCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request body for pledging a donation.
 *
 * Carries no tier and no state: both are looked up on the server.
 */
@Value
public class CreateCelebrationRequest {

    @NotNull(message = "Donor ID is required")
    @JsonProperty("donor_id")
    UUID donorId;

    @NotBlank(message = "Politician ID is required")
    @JsonProperty("politician_id")
    String politicianId;

    @NotBlank(message = "Bill ID is required")
    @JsonProperty("bill_id")
    String billId;

    @NotNull(message = "Donation is required")
    @DecimalMin(value = "1.00", message = "Donation must be at least $1")
    @JsonProperty("donation")
    BigDecimal donation;

    @DecimalMin(value = "0.00", message = "Tip cannot be negative")
    @JsonProperty("tip")
    BigDecimal tip;

    public CreateCelebrationCommand toCommand() {
        return CreateCelebrationCommand.builder()
                .donorId(donorId)
                .politicianId(politicianId)
                .billId(billId)
                .donation(donation)
                .tip(tip != null ? tip : BigDecimal.ZERO)
                .build();
    }
}
