package com.flagship.pledge_compliance.session;

/**
 * Source of truth for whether the current legislative session has ended.
 *
 * Callers react to the signal; implementations never trigger conversions themselves.
 */
public interface LegislativeSessionSignal {

    boolean isSessionEnded();

    boolean isInWarningPeriod();

    SessionInfo getSessionInfo();
}
