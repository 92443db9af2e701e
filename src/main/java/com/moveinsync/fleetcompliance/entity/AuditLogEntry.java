package com.moveinsync.fleetcompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Audit & Compliance Event Log
 *
 * Append-only record of every mutation (vehicle create/update/delete, document
 * upload, alert acknowledgment) and report access. Entries are never updated or
 * deleted: deleting a vehicle keeps its audit history.
 *
 * Fields:
 *  - userId             : acting user, always passed explicitly by the caller
 *  - action             : typed enum: no raw strings (AuditAction)
 *  - entityType/Id      : what was touched
 *  - entityRegistration : denormalized vehicle registration, survives vehicle deletion
 *  - details            : JSON object, e.g. {"make": {"old": "Tata", "new": "Volvo"}}
 *
 * DB Indexes:
 *  - idx_audit_timestamp : newest-first listing and date-range filters
 *  - idx_audit_entity    : per-entity history
 */
@Entity
@Table(
    name = "audit_log_entries",
    indexes = {
        @Index(name = "idx_audit_timestamp", columnList = "event_timestamp"),
        @Index(name = "idx_audit_entity",    columnList = "entity_type, entity_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Server time when the action was recorded */
    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false)
    private AuditEntityType entityType;

    @Column(name = "entity_id", updatable = false)
    private String entityId;

    @Column(updatable = false)
    private String entityRegistration;

    @Lob
    @Column(updatable = false)
    private String details;
}
