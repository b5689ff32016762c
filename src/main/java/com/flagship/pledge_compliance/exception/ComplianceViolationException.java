package com.flagship.pledge_compliance.exception;

import com.flagship.pledge_compliance.compliance.LimitInfo;
import lombok.Getter;

/**
 * Thrown when an attempted donation breaks a contribution limit.
 *
 * Carries the violated limit so the caller can show which one and why.
 */
@Getter
public class ComplianceViolationException extends RuntimeException {

    private final LimitInfo limitInfo;

    public ComplianceViolationException(LimitInfo limitInfo) {
        super(limitInfo.getMessage());
        this.limitInfo = limitInfo;
    }
}
