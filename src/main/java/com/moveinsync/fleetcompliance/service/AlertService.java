package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.AlertResponse;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.repository.AlertRepository;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alert inbox of one owner. Alerts are only created and removed by AlertSynchronizer;
 * the owner can only flip the read flag.
 *
 * Also the per-vehicle transaction boundary for FleetAlertSyncService: calling
 * synchronizeVehicle from that bean goes through the proxy, so each vehicle gets
 * its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertRepository alertRepository;
    private final VehicleRepository vehicleRepository;
    private final AlertSynchronizer alertSynchronizer;
    private final AuditService auditService;

    /** Newest first */
    @Transactional(readOnly = true)
    public List<AlertResponse> list(String ownerId, boolean unreadOnly) {
        List<ComplianceAlert> alerts = unreadOnly
                ? alertRepository.findByOwnerIdAndReadFalseOrderByCreatedAtDescIdDesc(ownerId)
                : alertRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId);
        log.debug("ALERTS: {} {}alert(s) for '{}'", alerts.size(), unreadOnly ? "unread " : "", ownerId);
        return alerts.stream().map(AlertResponse::from).toList();
    }

    /**
     * Locks one vehicle and reconciles the owner's alerts for it, in its own transaction.
     *
     * @return false when the vehicle no longer exists
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public boolean synchronizeVehicle(Long vehicleId, String ownerId) {
        Optional<Vehicle> locked = vehicleRepository.findByIdForUpdate(vehicleId);
        if (locked.isEmpty()) {
            log.debug("ALERTS: Vehicle #{} vanished before synchronization", vehicleId);
            return false;
        }
        alertSynchronizer.synchronize(locked.get(), ownerId);
        return true;
    }

    @Transactional(readOnly = true)
    public long unreadCount(String ownerId) {
        return alertRepository.countByOwnerIdAndReadFalse(ownerId);
    }

    /**
     * Marks one of the owner's alerts as read. Marking an already-read alert succeeds
     * without a second audit entry.
     *
     * @return false when the alert does not exist or belongs to another owner
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public boolean markRead(Long alertId, String ownerId) {
        Optional<ComplianceAlert> found = alertRepository.findByIdAndOwnerId(alertId, ownerId);
        if (found.isEmpty()) {
            log.warn("ALERTS: Alert #{} not found for owner '{}'", alertId, ownerId);
            return false;
        }
        ComplianceAlert alert = found.get();
        if (alert.isRead()) {
            log.debug("ALERTS: Alert #{} already read by '{}'", alertId, ownerId);
            return true;
        }

        alert.setRead(true);
        alertRepository.save(alert);
        log.info("ALERTS: Alert #{} ({}) marked read by '{}'", alertId, alert.getVehicleRegistration(), ownerId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("vehicleId", alert.getVehicleId());
        details.put("documentType", alert.getDocumentType().name());
        details.put("customDocumentTypeName", alert.getCustomDocumentTypeName());
        details.put("message", alert.getMessage());
        auditService.record(ownerId, AuditAction.MARK_ALERT_READ, AuditEntityType.ALERT,
                String.valueOf(alertId), details, alert.getVehicleRegistration());
        return true;
    }
}
