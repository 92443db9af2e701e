package com.moveinsync.fleetcompliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Fleet Document Compliance Tracking & Expiry Alerting Service
 */
@SpringBootApplication
public class FleetComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetComplianceApplication.class, args);
    }

}
