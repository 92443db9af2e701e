package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import com.moveinsync.fleetcompliance.repository.AlertRepository;
import com.moveinsync.fleetcompliance.util.ComplianceDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles one owner's alerts for one vehicle with the vehicle's current documents.
 *
 * Steps:
 * 1. Evaluate every tracked obligation; EXPIRING_SOON / OVERDUE ones are "desired"
 * 2. Read alerts are never touched: and their key is never raised again
 * 3. Unread alerts whose key is no longer desired are removed (superseded by a renewal)
 * 4. Unread alerts still desired are kept; their message is refreshed if it changed
 *    (expiring → overdue, registration edited)
 * 5. Desired keys with no alert yet get a new unread alert
 *
 * Idempotent: with unchanged documents and the same day, a second pass changes nothing.
 * Callers must hold the vehicle's mutation lock (see VehicleRepository.findByIdForUpdate).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertSynchronizer {

    private final AlertRepository alertRepository;
    private final VehicleComplianceAggregator aggregator;
    private final Clock clock;

    /**
     * @param vehicle persisted vehicle with its document history loaded
     * @param ownerId user whose alert inbox is reconciled
     * @return the owner's unread alerts for this vehicle after reconciliation
     */
    public List<ComplianceAlert> synchronize(Vehicle vehicle, String ownerId) {
        Map<AlertKey, ObligationStatus> desired = new LinkedHashMap<>();
        for (ObligationStatus status : aggregator.evaluate(vehicle)) {
            if (status.isAlerting()) {
                desired.put(AlertKey.of(vehicle, status.getGoverningDocument(), ownerId), status);
            }
        }

        List<ComplianceAlert> existing =
                alertRepository.findByVehicleIdAndOwnerIdOrderByIdAsc(vehicle.getId(), ownerId);

        // Acknowledged alerts block re-creation of their key
        Set<AlertKey> covered = new HashSet<>();
        existing.stream().filter(ComplianceAlert::isRead).map(AlertKey::of).forEach(covered::add);

        List<ComplianceAlert> unread = new ArrayList<>();
        int removed = 0;
        int refreshed = 0;
        for (ComplianceAlert alert : existing) {
            if (alert.isRead()) {
                continue;
            }
            AlertKey key = AlertKey.of(alert);
            ObligationStatus wanted = desired.get(key);
            if (wanted == null || !covered.add(key)) {
                alertRepository.delete(alert);
                removed++;
                continue;
            }
            String message = buildMessage(vehicle, wanted);
            if (!message.equals(alert.getMessage())
                    || !vehicle.getRegistrationNumber().equals(alert.getVehicleRegistration())) {
                alert.setMessage(message);
                alert.setVehicleRegistration(vehicle.getRegistrationNumber());
                alertRepository.save(alert);
                refreshed++;
            }
            unread.add(alert);
        }

        int created = 0;
        for (Map.Entry<AlertKey, ObligationStatus> entry : desired.entrySet()) {
            if (covered.contains(entry.getKey())) {
                continue;
            }
            unread.add(alertRepository.save(newAlert(vehicle, entry.getValue(), ownerId)));
            covered.add(entry.getKey());
            created++;
        }

        if (created > 0 || removed > 0 || refreshed > 0) {
            log.info("ALERTS: Vehicle {} / owner '{}': created: {}, removed: {}, refreshed: {}, unread now: {}",
                    vehicle.getRegistrationNumber(), ownerId, created, removed, refreshed, unread.size());
        } else {
            log.debug("ALERTS: Vehicle {} / owner '{}' already in sync ({} unread)",
                    vehicle.getRegistrationNumber(), ownerId, unread.size());
        }
        return unread;
    }

    private ComplianceAlert newAlert(Vehicle vehicle, ObligationStatus status, String ownerId) {
        VehicleDocument governing = status.getGoverningDocument();
        return ComplianceAlert.builder()
                .vehicleId(vehicle.getId())
                .vehicleRegistration(vehicle.getRegistrationNumber())
                .documentType(governing.getDocumentType())
                .customDocumentTypeName(status.getObligation().getCustomTypeName())
                .policyNumber(governing.getPolicyNumber())
                .dueDate(governing.getExpiryDate())
                .message(buildMessage(vehicle, status))
                .createdAt(LocalDateTime.now(clock))
                .read(false)
                .ownerId(ownerId)
                .build();
    }

    /**
     * e.g. "Insurance (Ref: INS-04411) for KA01AB1234 is expiring on Nov 02, 2026."
     */
    static String buildMessage(Vehicle vehicle, ObligationStatus status) {
        VehicleDocument governing = status.getGoverningDocument();
        String reference = governing.getPolicyNumber() != null && !governing.getPolicyNumber().isBlank()
                ? governing.getPolicyNumber() : "N/A";
        String when = status.getStatus() == DocumentStatus.OVERDUE
                ? "overdue since " + ComplianceDates.formatForDisplay(governing.getExpiryDate())
                : "expiring on " + ComplianceDates.formatForDisplay(governing.getExpiryDate());
        return String.format("%s (Ref: %s) for %s is %s.",
                status.getObligation().getDisplayName(), reference, vehicle.getRegistrationNumber(), when);
    }
}
