package com.flagship.pledge_compliance.session;

import lombok.Value;

/**
 * Outcome of one bulk defunct conversion run.
 */
@Value
public class DefunctConversionSummary {
    int convertedCount;
    int failedCount;
    int donorsNotified;
    SessionInfo sessionInfo;

    public static DefunctConversionSummary nothingToDo(SessionInfo sessionInfo) {
        return new DefunctConversionSummary(0, 0, 0, sessionInfo);
    }
}
