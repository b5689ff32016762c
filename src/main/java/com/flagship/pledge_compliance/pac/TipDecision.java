package com.flagship.pledge_compliance.pac;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of applying the PAC limit to the tip of one pledge.
 *
 * The base donation is never affected: an over-limit tip is truncated to zero,
 * the pledge still goes through.
 */
@Value
public class TipDecision {
    BigDecimal requestedTip;
    BigDecimal acceptedTip;
    BigDecimal newPacTotal;
    boolean limitReached;
    boolean truncated;
}
