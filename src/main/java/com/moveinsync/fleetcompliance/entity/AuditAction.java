package com.moveinsync.fleetcompliance.entity;

/**
 * Closed set of audited actions.
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum AuditAction {

    CREATE_VEHICLE,
    UPDATE_VEHICLE,
    DELETE_VEHICLE,

    UPLOAD_DOCUMENT,
    UPDATE_DOCUMENT,
    DELETE_DOCUMENT,

    MARK_ALERT_READ,

    VIEW_REPORT,
    EXPORT_REPORT,

    /** Sample data loaded at startup */
    SYSTEM_INIT
}
