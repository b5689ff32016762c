package com.flagship.pledge_compliance.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.celebration.StatusDuration;
import com.flagship.pledge_compliance.celebration.StatusHistory;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class StatusHistoryResponse {

    @JsonProperty("total_changes")
    long totalChanges;

    @JsonProperty("recent_changes")
    List<LedgerEntryResponse> recentChanges;

    @JsonProperty("current_status")
    String currentStatus;

    @JsonProperty("status_duration")
    StatusDurationResponse statusDuration;

    public static StatusHistoryResponse from(StatusHistory history) {
        return new StatusHistoryResponse(
                history.getTotalChanges(),
                history.getRecentChanges().stream().map(LedgerEntryResponse::from).toList(),
                history.getCurrentStatus().getValue(),
                StatusDurationResponse.from(history.getStatusDuration()));
    }

    @Value
    public static class StatusDurationResponse {

        @JsonProperty("current_status_duration_days")
        long currentStatusDurationDays;

        @JsonProperty("total_lifetime_days")
        long totalLifetimeDays;

        @JsonProperty("last_change_date")
        Instant lastChangeDate;

        public static StatusDurationResponse from(StatusDuration duration) {
            return new StatusDurationResponse(
                    duration.getCurrentStatusDurationDays(),
                    duration.getTotalLifetimeDays(),
                    duration.getLastChangeDate());
        }
    }
}
