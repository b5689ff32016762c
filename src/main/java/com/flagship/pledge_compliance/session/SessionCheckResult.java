package com.flagship.pledge_compliance.session;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * What a session check did. {@code conversion} is set only for {@link Action#CONVERTED}.
 */
@Value
public class SessionCheckResult {
    Action action;
    DefunctConversionSummary conversion;
    int donorsWarned;
    SessionInfo sessionInfo;

    public enum Action {
        CONVERTED("converted"),
        WARNED("warned"),
        NO_ACTION("no_action");

        private final String value;

        Action(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
