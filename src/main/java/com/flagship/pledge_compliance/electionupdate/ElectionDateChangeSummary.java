package com.flagship.pledge_compliance.electionupdate;

import lombok.Value;

@Value
public class ElectionDateChangeSummary {
    String state;
    boolean datesChanged;
    int donorsWithActivePledges;
    int residentsOnly;
    int pledgeNotificationsSent;
    int residentNotificationsSent;
    int failedCount;

    public int getTotalNotificationsSent() {
        return pledgeNotificationsSent + residentNotificationsSent;
    }

    static ElectionDateChangeSummary unchanged(String state) {
        return new ElectionDateChangeSummary(state, false, 0, 0, 0, 0, 0);
    }
}
