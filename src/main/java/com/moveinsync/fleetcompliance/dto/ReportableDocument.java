package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row of the expiring-documents report.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportableDocument {

    private Long documentId;
    private Long vehicleId;
    private String vehicleRegistration;
    private String vehicleType;
    private DocumentType documentType;
    private String customTypeName;
    private String displayName;
    private String policyNumber;
    private LocalDate startDate;
    private LocalDate expiryDate;
    private LocalDateTime uploadedAt;
    private DocumentStatus status;

    /** Days until expiry, negative when overdue, null without expiry date */
    private Long daysDifference;
}
