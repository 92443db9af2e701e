package com.moveinsync.fleetcompliance.entity;

public enum AuditEntityType {
    VEHICLE,
    DOCUMENT,
    ALERT,
    REPORT,
    SYSTEM
}
