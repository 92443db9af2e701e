package com.moveinsync.fleetcompliance.entity;

/**
 * Compliance status of a single document, derived from its expiry date.
 * Never persisted: always recomputed against the current date.
 */
public enum DocumentStatus {

    /** No expiry date, or the stored value is not a calendar date */
    MISSING,

    COMPLIANT,

    /** Expires within the configured warning window */
    EXPIRING_SOON,

    /** Expiry date is before today */
    OVERDUE
}
