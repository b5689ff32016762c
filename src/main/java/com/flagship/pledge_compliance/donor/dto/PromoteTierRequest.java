package com.flagship.pledge_compliance.donor.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Tier submitted by a completed verification form.
 */
@Value
public class PromoteTierRequest {

    @NotBlank(message = "Form tier is required")
    @JsonProperty("form_tier")
    String formTier;

    @JsonCreator
    public PromoteTierRequest(@JsonProperty("form_tier") String formTier) {
        this.formTier = formTier;
    }
}
