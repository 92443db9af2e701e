package com.moveinsync.fleetcompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A single uploaded document instance (not a slot).
 *
 * Documents are append-only history: never updated after upload and only removed
 * together with their vehicle. The ai* columns keep what the extraction service
 * suggested for audit/comparison; they are never used for compliance.
 *
 * DB Indexes:
 *  - idx_document_vehicle_type : governing-document lookup per (vehicle, type)
 */
@Entity
@Table(
    name = "vehicle_documents",
    indexes = {
        @Index(name = "idx_document_vehicle_type", columnList = "vehicle_id, document_type")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false)
    private DocumentType documentType;

    /** Only set for DocumentType.OTHER */
    private String customTypeName;

    /** Policy / certificate / permit reference number */
    private String policyNumber;

    private LocalDate startDate;

    /** Null until the expiry date is established: such a document never governs */
    private LocalDate expiryDate;

    private String documentName;

    private String documentUrl;

    @Column(name = "uploaded_at", nullable = false)
    private LocalDateTime uploadedAt;

    private String aiExtractedPolicyNumber;

    private Double aiPolicyNumberConfidence;

    private LocalDate aiExtractedStartDate;

    private Double aiStartDateConfidence;

    private LocalDate aiExtractedExpiryDate;

    private Double aiExpiryDateConfidence;

    /** Label used in alert messages and reports: the custom name for OTHER, the type label otherwise */
    public String getDisplayName() {
        if (documentType == DocumentType.OTHER && customTypeName != null) {
            return customTypeName;
        }
        return documentType != null ? documentType.getLabel() : null;
    }
}
