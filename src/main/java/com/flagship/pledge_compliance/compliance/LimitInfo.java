package com.flagship.pledge_compliance.compliance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Description of a violated limit, returned to the donor.
 *
 * {@code amount} is the limit itself, not the attempted donation.
 */
@Value
@Builder
public class LimitInfo {
    LimitType limitType;
    BigDecimal amount;
    String scope;
    String message;
}
