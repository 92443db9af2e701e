package com.moveinsync.fleetcompliance.entity;

/**
 * Vehicle-level compliance verdict.
 *
 * Precedence: OVERDUE, then EXPIRING_SOON; MISSING_INFO is only evaluated
 * when neither applies.
 */
public enum VehicleComplianceStatus {

    COMPLIANT,

    EXPIRING_SOON,

    OVERDUE,

    /** An essential document kind has no governing document */
    MISSING_INFO
}
