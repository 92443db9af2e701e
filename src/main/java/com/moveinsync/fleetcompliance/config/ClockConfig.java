package com.moveinsync.fleetcompliance.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Provides the Clock every compliance rule reads "today" from.
 *
 * compliance.time-zone decides which calendar day "today" is; blank uses the JVM zone.
 * Tests replace this bean with Clock.fixed(...).
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Bean
    public Clock complianceClock(@Value("${compliance.time-zone:}") String timeZone) {
        ZoneId zone = (timeZone == null || timeZone.isBlank())
                ? ZoneId.systemDefault()
                : ZoneId.of(timeZone.trim());
        log.info("[CLOCK] Compliance calendar zone: {}", zone);
        return Clock.system(zone);
    }
}
