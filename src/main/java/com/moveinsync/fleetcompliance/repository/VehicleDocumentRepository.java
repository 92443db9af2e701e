package com.moveinsync.fleetcompliance.repository;

import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for VehicleDocument: documents are only ever inserted.
 * Reads go through the owning Vehicle's ordered history.
 */
@Repository
public interface VehicleDocumentRepository extends JpaRepository<VehicleDocument, Long> {
}
