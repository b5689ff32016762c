package com.flagship.pledge_compliance.celebration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Processing fee charged on the base donation: {@code donation * percentage + addend},
 * rounded half-up to cents. Tips carry no fee.
 */
@Component
public class FeeCalculator {

    private final BigDecimal percentage;
    private final BigDecimal addend;

    public FeeCalculator(@Value("${compliance.fee.percentage:0.029}") BigDecimal percentage,
                         @Value("${compliance.fee.addend:0.30}") BigDecimal addend) {
        if (percentage.signum() < 0 || addend.signum() < 0) {
            throw new IllegalArgumentException("Fee percentage and addend must not be negative");
        }
        this.percentage = percentage;
        this.addend = addend;
    }

    public BigDecimal feeFor(BigDecimal donation) {
        if (donation == null || donation.signum() <= 0) {
            throw new IllegalArgumentException("Donation amount must be positive");
        }
        return donation.multiply(percentage).add(addend).setScale(2, RoundingMode.HALF_UP);
    }
}
