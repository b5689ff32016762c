package com.flagship.pledge_compliance.election;

import java.util.List;
import java.util.Optional;

/**
 * Server-side record of which state each pledge recipient stands for.
 *
 * The recipient's state picks the election calendar a verified donor's
 * per-election total is measured against, so it is never taken from a request.
 */
public interface PoliticianDirectory {

    /**
     * @param politicianId Recipient identifier as pledged
     * @return Two-letter state code, or empty if the recipient is unknown
     */
    Optional<String> findState(String politicianId);

    /**
     * @param state Two-letter state code
     * @return Recipients standing for the state who can receive pledges
     */
    List<String> findPledgeableIdsByState(String state);
}
