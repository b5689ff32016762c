package com.flagship.pledge_compliance.session;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Snapshot of the current congressional session as seen at {@code evaluatedAt}.
 */
@Value
@Builder
public class SessionInfo {
    int congressNumber;
    int sessionNumber;
    String sessionType;
    LocalDate sessionStartDate;
    LocalDate sessionEndDate;
    LocalDate nextElectionDate;
    LocalDate warningPeriodStart;
    EndDateSource endDateSource;
    boolean inWarningPeriod;
    boolean hasEnded;
    Instant evaluatedAt;

    public enum EndDateSource {
        AUTHORITATIVE("authoritative"),
        FALLBACK("fallback");

        private final String value;

        EndDateSource(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
