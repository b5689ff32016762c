package com.flagship.pledge_compliance.celebration;

import lombok.Value;

/**
 * A single "best efforts" finding on a donor field.
 */
@Value
public class ValidationFlag {
    String field;
    String reason;
    String match;
    String originalValue;
}
