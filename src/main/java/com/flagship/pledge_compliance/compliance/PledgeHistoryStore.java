package com.flagship.pledge_compliance.compliance;

import java.util.List;
import java.util.UUID;

/**
 * Read access to a donor's pledge history for limit aggregation.
 */
public interface PledgeHistoryStore {

    /**
     * All pledges made by a donor, in no particular order.
     */
    List<PledgeRecord> findByDonor(UUID donorId);
}
