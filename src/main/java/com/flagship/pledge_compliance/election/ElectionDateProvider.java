package com.flagship.pledge_compliance.election;

import java.util.Optional;

/**
 * Source of published election dates.
 *
 * Implementations may return stale data or nothing at all; callers fall back
 * to {@link ElectionDates#fallback(String, int)}.
 */
public interface ElectionDateProvider {

    /**
     * @param state Two-letter state code
     * @return Published dates for the state, or empty if none are known
     */
    Optional<ElectionDates> getElectionDates(String state);

    /**
     * Replaces the published dates of {@code dates.getState()}.
     */
    void saveElectionDates(ElectionDates dates);
}
