package com.flagship.pledge_compliance.compliance;

/**
 * Which rule set produced a compliance decision.
 */
public enum ValidationMode {
    /** Election-cycle aware limits. */
    ENHANCED,
    /** Calendar-year and campaign-window limits used when the enhanced check fails. */
    LEGACY
}
