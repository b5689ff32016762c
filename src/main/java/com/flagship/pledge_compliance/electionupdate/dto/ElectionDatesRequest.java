package com.flagship.pledge_compliance.electionupdate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.election.ElectionDates;
import lombok.Value;

import java.time.LocalDate;

/**
 * New published dates for one state. An omitted date is cleared.
 */
@Value
public class ElectionDatesRequest {

    @JsonProperty("primary_date")
    LocalDate primaryDate;

    @JsonProperty("general_date")
    LocalDate generalDate;

    @JsonProperty("runoff_date")
    LocalDate runoffDate;

    @JsonProperty("special_date")
    LocalDate specialDate;

    public ElectionDates toElectionDates(String state) {
        return ElectionDates.authoritative(state, primaryDate, generalDate, runoffDate, specialDate);
    }
}
