package com.flagship.pledge_compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the pledge compliance service.
 *
 * Hosts the donation limit engine, the PAC tip tracker and the celebration
 * status lifecycle behind a small REST surface.
 */
@SpringBootApplication
@EnableScheduling
public class PledgeComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PledgeComplianceApplication.class, args);
    }
}
