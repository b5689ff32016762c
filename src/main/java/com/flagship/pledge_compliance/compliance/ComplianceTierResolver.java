package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/**
 * Determines a donor's effective contribution tier.
 *
 * Unknown tier names never fail a request: they degrade to
 * {@link ComplianceTier#UNVERIFIED}, the most restrictive tier, and the
 * degradation is logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComplianceTierResolver {

    public enum Extremum {
        MIN, MAX
    }

    private final ComplianceMetrics metrics;

    /**
     * Maps a tier name to a tier, degrading unknown names to unverified.
     */
    public ComplianceTier resolve(String tierName) {
        return ComplianceTier.parse(tierName).orElseGet(() -> {
            if (tierName != null) {
                log.warn("Unrecognized compliance tier '{}', treating as {}",
                        tierName, ComplianceTier.UNVERIFIED.getValue());
                metrics.recordDegradedData("compliance_tier");
            }
            return ComplianceTier.UNVERIFIED;
        });
    }

    /**
     * Effective tier while a verification form is in progress: the higher of
     * the stored user tier and the tier the form would grant.
     *
     * @param userTier Tier stored on the donor
     * @param formTier Tier requested by the in-progress form, may be null
     * @return The higher of the two
     */
    public ComplianceTier effectiveTier(String userTier, String formTier) {
        ComplianceTier user = resolve(userTier);
        if (formTier == null) {
            return user;
        }
        ComplianceTier form = resolve(formTier);
        return form.isHigherThan(user) ? form : user;
    }

    /**
     * Position of a tier name in the hierarchy; unknown names rank as unverified.
     */
    public int indexOf(String tierName) {
        return resolve(tierName).rank();
    }

    /**
     * Lowest or highest tier among the given names, used for limit messaging.
     * An empty collection yields unverified.
     */
    public ComplianceTier extremum(Collection<String> tierNames, Extremum extremum) {
        Comparator<ComplianceTier> byRank = Comparator.comparingInt(ComplianceTier::rank);
        return tierNames.stream()
                .filter(Objects::nonNull)
                .map(this::resolve)
                .reduce((a, b) -> extremum == Extremum.MAX
                        ? (byRank.compare(a, b) >= 0 ? a : b)
                        : (byRank.compare(a, b) <= 0 ? a : b))
                .orElse(ComplianceTier.UNVERIFIED);
    }
}
