package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertResponse {

    private Long id;
    private Long vehicleId;
    private String vehicleRegistration;
    private DocumentType documentType;
    private String customDocumentTypeName;
    private String policyNumber;
    private LocalDate dueDate;
    private String message;
    private LocalDateTime createdAt;
    private boolean read;

    public static AlertResponse from(ComplianceAlert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .vehicleId(alert.getVehicleId())
                .vehicleRegistration(alert.getVehicleRegistration())
                .documentType(alert.getDocumentType())
                .customDocumentTypeName(alert.getCustomDocumentTypeName())
                .policyNumber(alert.getPolicyNumber())
                .dueDate(alert.getDueDate())
                .message(alert.getMessage())
                .createdAt(alert.getCreatedAt())
                .read(alert.isRead())
                .build();
    }
}
