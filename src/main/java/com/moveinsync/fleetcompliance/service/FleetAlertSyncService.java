package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.FleetSyncResult;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fleet-wide alert synchronization.
 *
 * Alerts depend on "today", so an EXPIRING_SOON document turns OVERDUE (and a
 * COMPLIANT one turns EXPIRING_SOON) without any upload. The daily job catches
 * those transitions for the configured owners; POST /api/alerts/sync runs the
 * same pass on demand for the caller.
 *
 * Each vehicle is synchronized in its own transaction via AlertService. A vehicle
 * that fails is logged and reported; the rest of the fleet still goes through.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FleetAlertSyncService {

    private final VehicleRepository vehicleRepository;
    private final AlertService alertService;

    /** Comma-separated owners whose inboxes the scheduled job refreshes */
    @Value("${compliance.alerts.sync-owner-ids:}")
    private String[] scheduledOwnerIds;

    public FleetSyncResult synchronizeAll(String ownerId) {
        List<Long> vehicleIds = vehicleRepository.findAllIds();
        log.info("ALERTS: Fleet sync started for '{}' ({} vehicle(s))", ownerId, vehicleIds.size());

        int synced = 0;
        List<Long> failed = new ArrayList<>();
        for (Long vehicleId : vehicleIds) {
            try {
                if (alertService.synchronizeVehicle(vehicleId, ownerId)) {
                    synced++;
                }
            } catch (Exception e) {
                log.error("ALERTS: Sync failed for vehicle #{} / owner '{}': {}",
                        vehicleId, ownerId, e.getMessage(), e);
                failed.add(vehicleId);
            }
        }

        long unread = alertService.unreadCount(ownerId);
        log.info("ALERTS: Fleet sync complete for '{}', total: {}, synced: {}, failed: {}, unread: {}",
                ownerId, vehicleIds.size(), synced, failed.size(), unread);
        return FleetSyncResult.builder()
                .ownerId(ownerId)
                .totalVehicles(vehicleIds.size())
                .synchronizedVehicles(synced)
                .failedVehicleIds(List.copyOf(failed))
                .unreadAlerts(unread)
                .build();
    }

    /** Daily pass for compliance.alerts.sync-owner-ids; "-" as cron disables it */
    @Scheduled(cron = "${compliance.alerts.sync-cron:0 5 0 * * *}")
    public void scheduledSync() {
        List<String> owners = scheduledOwners();
        if (owners.isEmpty()) {
            log.debug("ALERTS: Scheduled sync skipped, no owners configured");
            return;
        }
        for (String owner : owners) {
            try {
                synchronizeAll(owner);
            } catch (Exception e) {
                log.error("ALERTS: Scheduled sync aborted for owner '{}': {}", owner, e.getMessage(), e);
            }
        }
    }

    List<String> scheduledOwners() {
        if (scheduledOwnerIds == null) {
            return List.of();
        }
        return Arrays.stream(scheduledOwnerIds)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
