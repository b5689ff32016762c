package com.flagship.pledge_compliance.config;

import com.flagship.pledge_compliance.compliance.TierRule;
import com.flagship.pledge_compliance.compliance.TierRuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Contribution limit tables.
 */
@Configuration
@Slf4j
public class ComplianceConfig {

    @Bean
    public TierRuleTable tierRuleTable() {
        TierRuleTable table = TierRuleTable.defaults();
        for (TierRule rule : table.all()) {
            log.info("Tier {}: perDonation={}, annualCap={}, perElection={}, reset={}",
                    rule.getTier().getValue(), rule.getPerDonationLimit(), rule.getAnnualCap(),
                    rule.getPerElectionLimit(), rule.getResetType().getValue());
        }
        return table;
    }
}
