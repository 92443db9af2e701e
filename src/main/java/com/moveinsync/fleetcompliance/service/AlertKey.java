package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import lombok.Value;

import java.time.LocalDate;

/**
 * Deduplication key of an alert, compared field by field.
 *
 * Two alerts with the same key describe the same governing document state for the
 * same owner: a renewal changes dueDate (and usually referenceNumber) and so
 * produces a different key.
 */
@Value
public class AlertKey {

    Long vehicleId;
    DocumentType documentType;
    String customTypeName;
    LocalDate dueDate;
    String referenceNumber;
    String ownerId;

    public static AlertKey of(ComplianceAlert alert) {
        return new AlertKey(alert.getVehicleId(), alert.getDocumentType(),
                normalizeCustomName(alert.getDocumentType(), alert.getCustomDocumentTypeName()),
                alert.getDueDate(), alert.getPolicyNumber(), alert.getOwnerId());
    }

    public static AlertKey of(Vehicle vehicle, VehicleDocument governing, String ownerId) {
        return new AlertKey(vehicle.getId(), governing.getDocumentType(),
                normalizeCustomName(governing.getDocumentType(), governing.getCustomTypeName()),
                governing.getExpiryDate(), governing.getPolicyNumber(), ownerId);
    }

    private static String normalizeCustomName(DocumentType type, String customName) {
        return type == DocumentType.OTHER ? customName : null;
    }
}
