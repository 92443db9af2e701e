package com.moveinsync.fleetcompliance.repository;

import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ComplianceAlert: alert inbox and synchronization queries.
 */
@Repository
public interface AlertRepository extends JpaRepository<ComplianceAlert, Long> {

    // ── Inbox ──────────────────────────────────────────────────────────────────

    List<ComplianceAlert> findByOwnerIdOrderByCreatedAtDescIdDesc(String ownerId);

    List<ComplianceAlert> findByOwnerIdAndReadFalseOrderByCreatedAtDescIdDesc(String ownerId);

    long countByOwnerIdAndReadFalse(String ownerId);

    Optional<ComplianceAlert> findByIdAndOwnerId(Long id, String ownerId);

    // ── Synchronization scope ──────────────────────────────────────────────────

    /** Every alert (read and unread) of one owner for one vehicle, oldest first */
    List<ComplianceAlert> findByVehicleIdAndOwnerIdOrderByIdAsc(Long vehicleId, String ownerId);

    /** Alerts of every owner for a vehicle: used when the vehicle is deleted */
    List<ComplianceAlert> findByVehicleId(Long vehicleId);
}
