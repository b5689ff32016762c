package com.flagship.pledge_compliance.compliance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.flagship.pledge_compliance.compliance.LimitSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Limit summary plus the amounts a client may offer next.
 * {@code clampedDonation} is present only when a staged amount was sent.
 */
@Value
@Builder
public class LimitSummaryResponse {

    @JsonUnwrapped
    LimitSummary summary;

    List<BigDecimal> suggestedAmounts;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    BigDecimal clampedDonation;
}
