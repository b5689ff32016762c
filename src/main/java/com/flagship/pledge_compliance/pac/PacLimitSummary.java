package com.flagship.pledge_compliance.pac;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only projection of a donor's PAC tip usage this calendar year.
 */
@Value
@Builder
public class PacLimitSummary {
    BigDecimal pacLimit;
    BigDecimal currentPACTotal;
    BigDecimal remainingPACLimit;
    boolean pacLimitExceeded;
    boolean compliant;
    boolean tipLimitReached;
}
