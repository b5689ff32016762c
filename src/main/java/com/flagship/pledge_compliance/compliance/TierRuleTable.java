package com.flagship.pledge_compliance.compliance;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyed table of tier limits.
 *
 * Adding a tier is a data change here, not a new branch in the validators.
 * A tier with no entry falls back to the unverified rule.
 */
public class TierRuleTable {

    private final Map<ComplianceTier, TierRule> rules;

    public TierRuleTable(Collection<TierRule> rules) {
        Map<ComplianceTier, TierRule> byTier = new EnumMap<>(ComplianceTier.class);
        for (TierRule rule : rules) {
            byTier.put(rule.getTier(), rule);
        }
        if (!byTier.containsKey(ComplianceTier.UNVERIFIED)) {
            throw new IllegalArgumentException("Tier table must define the unverified tier");
        }
        this.rules = Collections.unmodifiableMap(byTier);
    }

    /**
     * Default federal limits: $50 per donation and $200 a year for unverified
     * donors; $3,500 per donation and per candidate per election for verified ones.
     */
    public static TierRuleTable defaults() {
        TierRule unverified = TierRule.builder()
            .tier(ComplianceTier.UNVERIFIED)
            .perDonationLimit(new BigDecimal("50"))
            .perDonationScope("per donation")
            .annualCap(new BigDecimal("200"))
            .resetType(ResetType.ANNUAL)
            .description("per donation, $200 total annual cap across all candidates")
            .suggestedAmount(new BigDecimal("2"))
            .suggestedAmount(new BigDecimal("5"))
            .suggestedAmount(new BigDecimal("10"))
            .suggestedAmount(new BigDecimal("25"))
            .suggestedAmount(new BigDecimal("50"))
            .build();

        TierRule verified = TierRule.builder()
            .tier(ComplianceTier.VERIFIED)
            .perDonationLimit(new BigDecimal("3500"))
            .perDonationScope("per candidate per election")
            .perElectionLimit(new BigDecimal("3500"))
            .resetType(ResetType.ELECTION_CYCLE)
            .description("per donation, per candidate per election (primary/general separate)")
            .suggestedAmount(new BigDecimal("100"))
            .suggestedAmount(new BigDecimal("250"))
            .suggestedAmount(new BigDecimal("500"))
            .suggestedAmount(new BigDecimal("1000"))
            .suggestedAmount(new BigDecimal("3500"))
            .build();

        return new TierRuleTable(List.of(unverified, verified));
    }

    public TierRule ruleFor(ComplianceTier tier) {
        TierRule rule = tier != null ? rules.get(tier) : null;
        return rule != null ? rule : rules.get(ComplianceTier.UNVERIFIED);
    }

    public Collection<TierRule> all() {
        return rules.values();
    }
}
