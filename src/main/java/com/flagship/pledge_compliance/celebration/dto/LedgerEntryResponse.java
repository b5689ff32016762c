package com.flagship.pledge_compliance.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.celebration.AuditTrail;
import com.flagship.pledge_compliance.celebration.StatusLedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("status_change_id")
    UUID statusChangeId;

    @JsonProperty("sequence_number")
    int sequenceNumber;

    @JsonProperty("previous_status")
    String previousStatus;

    @JsonProperty("new_status")
    String newStatus;

    @JsonProperty("change_datetime")
    Instant changedAt;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("triggered_by")
    String triggeredBy;

    @JsonProperty("triggered_by_id")
    String triggeredById;

    @JsonProperty("triggered_by_name")
    String triggeredByName;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("compliance_tier_at_time")
    String complianceTierAtTime;

    @JsonProperty("fec_compliant")
    boolean fecCompliant;

    @JsonProperty("audit_trail")
    AuditTrail auditTrail;

    public static LedgerEntryResponse from(StatusLedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .statusChangeId(entry.getStatusChangeId())
                .sequenceNumber(entry.getSequenceNumber())
                .previousStatus(entry.getPreviousStatus() != null ? entry.getPreviousStatus().getValue() : "none")
                .newStatus(entry.getNewStatus().getValue())
                .changedAt(entry.getChangedAt())
                .reason(entry.getReason())
                .triggeredBy(entry.getTriggeredBy().getValue())
                .triggeredById(entry.getTriggeredById())
                .triggeredByName(entry.getTriggeredByName())
                .metadata(entry.getMetadata())
                .complianceTierAtTime(entry.getComplianceTierAtTime())
                .fecCompliant(entry.isFecCompliant())
                .auditTrail(entry.getAuditTrail())
                .build();
    }
}
