package com.flagship.pledge_compliance.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time sources for the compliance engine.
 *
 * Every limit and lifecycle computation reads "now" from the {@link Clock}
 * bean and interprets calendar boundaries in the compliance zone, never in
 * the server's default zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Civil zone used for annual resets and election-date interpretation.
     */
    @Bean
    public ZoneId complianceZone(@Value("${compliance.timezone:America/New_York}") String timezone) {
        return ZoneId.of(timezone);
    }
}
