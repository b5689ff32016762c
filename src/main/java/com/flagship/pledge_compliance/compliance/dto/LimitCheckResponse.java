package com.flagship.pledge_compliance.compliance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.pledge_compliance.compliance.LimitInfo;
import lombok.Value;

@Value
public class LimitCheckResponse {

    boolean wouldExceed;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    LimitInfo limitInfo;
}
