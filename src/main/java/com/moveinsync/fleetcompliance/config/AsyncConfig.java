package com.moveinsync.fleetcompliance.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background processing and store resilience.
 *
 * - @EnableScheduling : daily fleet-wide alert synchronization (FleetAlertSyncService)
 * - @EnableRetry      : @Retryable service mutations retried with exponential backoff
 *                       on transient store failures. The retry advice is ordered
 *                       outside the transaction advice, so each attempt runs in a
 *                       fresh transaction.
 */
@Configuration
@EnableScheduling
@EnableRetry
public class AsyncConfig {
}
