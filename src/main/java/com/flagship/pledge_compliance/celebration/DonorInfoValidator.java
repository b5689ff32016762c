package com.flagship.pledge_compliance.celebration;

import com.flagship.pledge_compliance.compliance.ComplianceTier;
import com.flagship.pledge_compliance.donor.Donor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * FEC "best efforts" checks on donor contact details.
 *
 * Only the verified tier is checked. Findings are returned as flags and never
 * reject a pledge; the recipient committee reviews flagged snapshots.
 *
 * Keywords match whole words, so "na" flags "N A Smith" but not "Nathan".
 */
@Component
@Slf4j
public class DonorInfoValidator {

    private static final Set<String> PLACEHOLDER_KEYWORDS = Set.of(
        "-", ".", "--", "...", "???", "idk", "na", "nil", "null", "same", "test", "tbd",
        "unk", "xxx", "yyy", "zzz", "asdf", "lorem", "n/a", "none", "no one", "qwerty",
        "refuse", "refused", "sample", "testing", "unknown", "dont know", "no idea",
        "prefer not", "don't know"
    );

    private static final Set<String> JOKEY_ADDRESS_KEYWORDS = Set.of(
        "hell", "mars", "moon", "heaven", "nowhere", "somewhere", "area 51", "at your house",
        "milky way", "planet earth", "white house", "under a bridge", "1600 pennsylvania ave"
    );

    private static final Set<String> NOT_EMPLOYED_CATEGORIES = Set.of(
        "disabled", "retired", "student", "unemployed", "homemaker", "not employed"
    );

    private static final Set<String> US_STATE_CODES = Set.of(
        "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA", "HI", "ID", "IL", "IN",
        "IA", "KS", "KY", "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV",
        "NH", "NJ", "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN",
        "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY", "DC", "AS", "GU", "MP", "PR", "VI"
    );

    private static final Pattern INITIALS_ONLY = Pattern.compile("^([A-Z]\\.\\s?){1,3}$");
    private static final Pattern STREET_FORMAT = Pattern.compile("(?=.*\\d)(?=.*[A-Za-z]).*");
    private static final Pattern US_ZIP = Pattern.compile("^\\d{5}(-\\d{4})?$");
    private static final Pattern REPEATED_ZIP = Pattern.compile("^(\\d)\\1{4}(-\\1{4})?$");

    private final Clock clock;

    public DonorInfoValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationFlags validate(Donor donor, ComplianceTier tier) {
        List<ValidationFlag> flags = new ArrayList<>();
        if (tier == ComplianceTier.VERIFIED) {
            checkName(donor, flags);
            checkAddress(donor, flags);
            checkOccupation(donor, flags);
            checkEmployer(donor, flags);
        }

        ValidationFlags result = ValidationFlags.of(flags, clock.instant());
        if (result.isFlagged()) {
            log.warn("Donor {} snapshot has {} validation flag(s): {}",
                donor.getId(), result.getTotalFlags(),
                flags.stream().map(f -> f.getField() + ":" + f.getMatch()).toList());
        }
        return result;
    }

    private void checkName(Donor donor, List<ValidationFlag> flags) {
        String first = trimToEmpty(donor.getFirstName());
        String last = trimToEmpty(donor.getLastName());
        String fullName = (first + " " + last).trim();

        if (first.isEmpty() || last.isEmpty()) {
            flags.add(new ValidationFlag("name", "Missing required name fields", "missing", fullName));
        }
        if (!fullName.isEmpty() && !fullName.contains(" ")) {
            flags.add(new ValidationFlag("name", "Single word name provided", "single_word", fullName));
        }
        if (INITIALS_ONLY.matcher(fullName).matches()) {
            flags.add(new ValidationFlag("name", "Only initials provided", "initials_only", fullName));
        }
        if (containsKeyword(fullName, PLACEHOLDER_KEYWORDS)) {
            flags.add(new ValidationFlag("name", "Placeholder or junk content detected", "placeholder", fullName));
        }
    }

    private void checkAddress(Donor donor, List<ValidationFlag> flags) {
        String address = trimToEmpty(donor.getAddress());
        String city = trimToEmpty(donor.getCity());
        String state = trimToEmpty(donor.getState());
        String zip = trimToEmpty(donor.getZip());

        if (address.isEmpty() || city.isEmpty() || state.isEmpty() || zip.isEmpty()) {
            String full = String.join(" ", address, city, state, zip).trim();
            flags.add(new ValidationFlag("address", "Missing required address fields", "missing",
                full.isEmpty() ? "Not provided" : full));
        }

        if (!address.isEmpty()) {
            if (containsKeyword(address, JOKEY_ADDRESS_KEYWORDS)) {
                flags.add(new ValidationFlag("address", "Jokey or impossible address detected", "jokey_address", address));
            }
            if (containsKeyword(address, PLACEHOLDER_KEYWORDS)) {
                flags.add(new ValidationFlag("address", "Placeholder content detected", "placeholder", address));
            }
            if (!STREET_FORMAT.matcher(address).matches()) {
                flags.add(new ValidationFlag("address", "Address format may be invalid", "invalid_format", address));
            }
        }

        if (!state.isEmpty() && !US_STATE_CODES.contains(state.toUpperCase(Locale.ROOT))) {
            flags.add(new ValidationFlag("state", "Invalid or non-US state code", "invalid_state", state));
        }

        if (!zip.isEmpty()) {
            // International postal codes are allowed through, only flagged
            if (!US_ZIP.matcher(zip).matches()) {
                flags.add(new ValidationFlag("zip", "Non-US ZIP code format (may be international postal code)",
                    "invalid_format", zip));
            }
            if (REPEATED_ZIP.matcher(zip).matches()) {
                flags.add(new ValidationFlag("zip", "ZIP code contains all same digits", "repeated_digits", zip));
            }
        }
    }

    private void checkOccupation(Donor donor, List<ValidationFlag> flags) {
        String occupation = trimToEmpty(donor.getOccupation());
        if (occupation.isEmpty()) {
            flags.add(new ValidationFlag("occupation", "Missing required occupation", "missing", "Not provided"));
            return;
        }
        if (containsKeyword(occupation, PLACEHOLDER_KEYWORDS)) {
            flags.add(new ValidationFlag("occupation", "Placeholder or junk content detected", "placeholder", occupation));
        }
    }

    private void checkEmployer(Donor donor, List<ValidationFlag> flags) {
        String occupation = normalize(donor.getOccupation());
        if (!donor.isEmployed() || NOT_EMPLOYED_CATEGORIES.contains(occupation)) {
            return;
        }
        String employer = trimToEmpty(donor.getEmployer());
        if (employer.isEmpty()) {
            flags.add(new ValidationFlag("employer", "Missing required employer", "missing", "Not provided"));
            return;
        }
        if (containsKeyword(employer, PLACEHOLDER_KEYWORDS)) {
            flags.add(new ValidationFlag("employer", "Placeholder or junk content detected", "placeholder", employer));
        }
    }

    static boolean containsKeyword(String text, Set<String> keywords) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return false;
        }
        String padded = " " + normalized + " ";
        for (String keyword : keywords) {
            if (padded.contains(" " + keyword + " ")) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String text) {
        return trimToEmpty(text).replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String trimToEmpty(String text) {
        return text == null ? "" : text.trim();
    }
}
