package com.moveinsync.fleetcompliance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * DTO for creating or updating a Vehicle.
 * The registration number is normalized (trimmed, upper-cased) by VehicleService.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleRequest {

    @NotBlank(message = "Registration number is required")
    @Size(max = 20, message = "Registration number must be at most 20 characters")
    private String registrationNumber;

    @NotBlank(message = "Make is required")
    private String make;

    @NotBlank(message = "Model is required")
    private String model;

    /** Free text; see GET /api/vehicles/type-suggestions */
    @NotBlank(message = "Vehicle type is required")
    private String vehicleType;
}
