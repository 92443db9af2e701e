package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import lombok.Value;

import java.util.Optional;

/**
 * Evaluated state of one tracked obligation: its governing document (if any) and
 * that document's status. Without a governing document the status is MISSING.
 */
@Value
public class ObligationStatus {

    DocumentObligation obligation;
    VehicleDocument governingDocument;
    DocumentStatus status;

    public Optional<VehicleDocument> governing() {
        return Optional.ofNullable(governingDocument);
    }

    /** True when the governing document should raise an alert */
    public boolean isAlerting() {
        return status == DocumentStatus.EXPIRING_SOON || status == DocumentStatus.OVERDUE;
    }
}
