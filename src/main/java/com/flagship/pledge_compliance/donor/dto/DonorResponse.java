package com.flagship.pledge_compliance.donor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.donor.Donor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Donor as returned by the API.
 */
@Value
@Builder
public class DonorResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("email")
    String email;

    @JsonProperty("name")
    String name;

    @JsonProperty("state")
    String state;

    @JsonProperty("compliance_tier")
    ComplianceTier complianceTier;

    @JsonProperty("tip_limit_reached")
    boolean tipLimitReached;

    @JsonProperty("created_at")
    Instant createdAt;

    public static DonorResponse from(Donor donor, ComplianceTier effectiveTier) {
        return DonorResponse.builder()
                .id(donor.getId())
                .email(donor.getEmail())
                .name(donor.fullName())
                .state(donor.getState())
                .complianceTier(effectiveTier)
                .tipLimitReached(donor.isTipLimitReached())
                .createdAt(donor.getCreatedAt())
                .build();
    }
}
