package com.flagship.pledge_compliance.compliance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Donation aggregates a limit check is evaluated against.
 *
 * {@code annualTotal} spans all recipients; {@code electionTotal} only the
 * selected recipient within the election window.
 */
@Value
public class DonationTotals {
    public static final DonationTotals ZERO = new DonationTotals(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal annualTotal;
    BigDecimal electionTotal;

    /**
     * Sums a donor's pledge history.
     *
     * @param history All pledges of the donor
     * @param recipientId Recipient whose election total is wanted, may be null
     * @param yearStart Start of the current annual period (inclusive)
     * @param windowStart Start of the election window (inclusive)
     * @param windowEnd End of the election window (inclusive)
     * @return Aggregates excluding defunct and paused pledges
     */
    public static DonationTotals from(Collection<PledgeRecord> history, String recipientId,
                                      Instant yearStart, Instant windowStart, Instant windowEnd) {
        BigDecimal annual = BigDecimal.ZERO;
        BigDecimal election = BigDecimal.ZERO;
        for (PledgeRecord pledge : history) {
            if (!pledge.countsTowardDonationLimits() || pledge.getCreatedAt() == null) {
                continue;
            }
            Instant createdAt = pledge.getCreatedAt();
            if (!createdAt.isBefore(yearStart)) {
                annual = annual.add(pledge.getDonationAmount());
            }
            if (recipientId != null && Objects.equals(recipientId, pledge.getRecipientId())
                    && !createdAt.isBefore(windowStart) && !createdAt.isAfter(windowEnd)) {
                election = election.add(pledge.getDonationAmount());
            }
        }
        return new DonationTotals(annual, election);
    }
}
