package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.donor.Donor;
import lombok.Value;

/**
 * Immutable copy of a donor's compliance-relevant fields, taken when a pledge is created.
 *
 * Stored with the pledge and never re-derived: later edits to the donor or a tier
 * promotion leave existing snapshots untouched.
 */
@Value
public class DonorInfoSnapshot {
    String firstName;
    String lastName;
    String email;
    String address;
    String city;
    String state;
    String zip;
    String country;
    String phoneNumber;
    boolean employed;
    String occupation;
    String employer;
    String compliance;
    ValidationFlags validationFlags;

    public static DonorInfoSnapshot capture(Donor donor, String complianceTier, ValidationFlags flags) {
        return new DonorInfoSnapshot(
            donor.getFirstName(),
            donor.getLastName(),
            donor.getEmail(),
            donor.getAddress(),
            donor.getCity(),
            donor.getState(),
            donor.getZip(),
            donor.getCountry(),
            donor.getPhoneNumber(),
            donor.isEmployed(),
            donor.getOccupation(),
            donor.getEmployer(),
            complianceTier,
            flags
        );
    }
}
