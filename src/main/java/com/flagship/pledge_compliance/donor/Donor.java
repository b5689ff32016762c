package com.flagship.pledge_compliance.donor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Donor aggregate.
 *
 * {@code complianceTier} is kept as stored so that legacy or corrupt values
 * reach the tier resolver, which degrades them instead of failing.
 * {@code tipLimitReached} is sticky: set when the PAC limit is reached and
 * cleared only by the annual reset job.
 */
@Value
@Builder(toBuilder = true)
public class Donor {
    UUID id;
    String email;
    String firstName;
    String lastName;
    String address;
    String city;
    String state;
    String zip;
    String country;
    boolean employed;
    String occupation;
    String employer;
    String phoneNumber;
    String complianceTier;
    boolean tipLimitReached;
    Instant createdAt;
    Instant updatedAt;

    public String fullName() {
        return ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
    }
}
