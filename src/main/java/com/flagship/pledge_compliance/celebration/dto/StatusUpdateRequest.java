package com.flagship.pledge_compliance.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.Map;

/**
 * Request body for status changes.
 *
 * {@code status} is read only by the generic endpoint. {@code details} lands in the
 * ledger metadata (pause details, resolution details). When {@code actor_id} is
 * present the change is recorded as a user action.
 */
@Value
public class StatusUpdateRequest {

    @JsonProperty("status")
    String status;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("details")
    Map<String, Object> details;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("actor_name")
    String actorName;
}
