package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleComplianceStatus;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleResponse {

    private Long id;
    private String registrationNumber;
    private String make;
    private String model;
    private String vehicleType;
    private VehicleComplianceStatus overallStatus;
    private int documentCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static VehicleResponse from(Vehicle vehicle, VehicleComplianceStatus overallStatus) {
        return VehicleResponse.builder()
                .id(vehicle.getId())
                .registrationNumber(vehicle.getRegistrationNumber())
                .make(vehicle.getMake())
                .model(vehicle.getModel())
                .vehicleType(vehicle.getVehicleType())
                .overallStatus(overallStatus)
                .documentCount(vehicle.getDocuments() != null ? vehicle.getDocuments().size() : 0)
                .createdAt(vehicle.getCreatedAt())
                .updatedAt(vehicle.getUpdatedAt())
                .build();
    }
}
