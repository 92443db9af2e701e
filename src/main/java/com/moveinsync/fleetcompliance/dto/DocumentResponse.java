package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import com.moveinsync.fleetcompliance.util.ComplianceDates;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One document of a vehicle's history, with its status computed against today.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentResponse {

    private Long id;
    private Long vehicleId;
    private DocumentType documentType;
    private String customTypeName;
    private String displayName;
    private String policyNumber;
    private LocalDate startDate;
    private LocalDate expiryDate;
    private String documentName;
    private String documentUrl;
    private LocalDateTime uploadedAt;
    private DocumentStatus status;

    private SuggestedField aiPolicyNumber;
    private SuggestedField aiStartDate;
    private SuggestedField aiExpiryDate;

    public static DocumentResponse from(VehicleDocument document, DocumentStatus status) {
        return DocumentResponse.builder()
                .id(document.getId())
                .vehicleId(document.getVehicle() != null ? document.getVehicle().getId() : null)
                .documentType(document.getDocumentType())
                .customTypeName(document.getCustomTypeName())
                .displayName(document.getDisplayName())
                .policyNumber(document.getPolicyNumber())
                .startDate(document.getStartDate())
                .expiryDate(document.getExpiryDate())
                .documentName(document.getDocumentName())
                .documentUrl(document.getDocumentUrl())
                .uploadedAt(document.getUploadedAt())
                .status(status)
                .aiPolicyNumber(suggestion(document.getAiExtractedPolicyNumber(),
                        document.getAiPolicyNumberConfidence()))
                .aiStartDate(suggestion(ComplianceDates.format(document.getAiExtractedStartDate()),
                        document.getAiStartDateConfidence()))
                .aiExpiryDate(suggestion(ComplianceDates.format(document.getAiExtractedExpiryDate()),
                        document.getAiExpiryDateConfidence()))
                .build();
    }

    private static SuggestedField suggestion(String value, Double confidence) {
        return value != null ? new SuggestedField(value, confidence) : null;
    }
}
