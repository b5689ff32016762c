package com.flagship.pledge_compliance.donor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pledge_compliance.donor.Donor;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Request body for registering a donor.
 */
@Value
public class RegisterDonorRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("address")
    String address;

    @JsonProperty("city")
    String city;

    @Pattern(regexp = "^[A-Za-z]{2}$", message = "State must be a 2-letter code")
    @JsonProperty("state")
    String state;

    @JsonProperty("zip")
    String zip;

    @JsonProperty("country")
    String country;

    @JsonProperty("is_employed")
    boolean employed;

    @JsonProperty("occupation")
    String occupation;

    @JsonProperty("employer")
    String employer;

    @JsonProperty("phone_number")
    String phoneNumber;

    public Donor toDonor() {
        return Donor.builder()
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .address(address)
                .city(city)
                .state(state)
                .zip(zip)
                .country(country)
                .employed(employed)
                .occupation(occupation)
                .employer(employer)
                .phoneNumber(phoneNumber)
                .build();
    }
}
