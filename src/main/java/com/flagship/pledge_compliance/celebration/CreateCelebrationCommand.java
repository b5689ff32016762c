package com.flagship.pledge_compliance.celebration;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Validated input for creating a pledge.
 */
@Value
@Builder
public class CreateCelebrationCommand {
    UUID donorId;
    String politicianId;
    String billId;
    BigDecimal donation;
    BigDecimal tip;
}
