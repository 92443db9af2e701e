package com.moveinsync.fleetcompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Expiry alert derived from a vehicle's governing documents.
 *
 * Alerts are reconstructible from document state at any time; the read flag is
 * the only state that must survive synchronization. Registration is denormalized
 * so the alert list renders without a vehicle join.
 *
 * DB Indexes:
 *  - idx_alert_owner_read   : unread badge / alert inbox per owner
 *  - idx_alert_vehicle_owner : synchronization scope (one vehicle, one owner)
 */
@Entity
@Table(
    name = "compliance_alerts",
    indexes = {
        @Index(name = "idx_alert_owner_read",    columnList = "owner_id, is_read"),
        @Index(name = "idx_alert_vehicle_owner", columnList = "vehicle_id, owner_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComplianceAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(nullable = false)
    private String vehicleRegistration;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false)
    private DocumentType documentType;

    private String customDocumentTypeName;

    private String policyNumber;

    /** Copy of the governing document's expiry date */
    @Column(nullable = false)
    private LocalDate dueDate;

    @Column(nullable = false, length = 500)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;
}
