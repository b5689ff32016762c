package com.flagship.pledge_compliance.donor;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for donors.
 *
 * No setters: the tier only moves through {@link #promoteTier(String)} and the
 * sticky flag through {@link #markTipLimitReached()}. Donors are never deleted.
 */
@Entity
@Table(
    name = "donors",
    indexes = {
        @Index(name = "idx_donors_email", columnList = "email")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DonorEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "address")
    private String address;

    @Column(name = "city")
    private String city;

    @Column(name = "state", length = 2)
    private String state;

    @Column(name = "zip", length = 10)
    private String zip;

    @Column(name = "country")
    private String country;

    @Column(name = "is_employed", nullable = false)
    private boolean employed;

    @Column(name = "occupation")
    private String occupation;

    @Column(name = "employer")
    private String employer;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Column(name = "compliance_tier", nullable = false, length = 32)
    private String complianceTier;

    @Column(name = "tip_limit_reached", nullable = false)
    private boolean tipLimitReached;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static DonorEntity fromDomain(Donor donor) {
        return new DonorEntity(
            donor.getId(),
            donor.getEmail(),
            donor.getFirstName(),
            donor.getLastName(),
            donor.getAddress(),
            donor.getCity(),
            donor.getState(),
            donor.getZip(),
            donor.getCountry(),
            donor.isEmployed(),
            donor.getOccupation(),
            donor.getEmployer(),
            donor.getPhoneNumber(),
            donor.getComplianceTier(),
            donor.isTipLimitReached(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Donor toDomain() {
        return Donor.builder()
            .id(id)
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
            .complianceTier(complianceTier)
            .tipLimitReached(tipLimitReached)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void promoteTier(String tier) {
        this.complianceTier = tier;
    }

    void markTipLimitReached() {
        this.tipLimitReached = true;
    }
}
