package com.moveinsync.fleetcompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Entity representing a Vehicle in the fleet.
 *
 * The vehicle owns its full document history: uploading a renewal appends a new
 * VehicleDocument and never overwrites an older one.
 */
@Entity
@Table(name = "vehicles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Business key, stored trimmed and upper-cased */
    @Column(nullable = false, unique = true)
    private String registrationNumber;

    private String make;

    private String model;

    /** Free text: see VehicleService.SUGGESTED_VEHICLE_TYPES */
    private String vehicleType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "vehicle", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("uploadedAt ASC")
    @Builder.Default
    private List<VehicleDocument> documents = new ArrayList<>();

    /** Appends a document to the history and links it back to this vehicle */
    public void addDocument(VehicleDocument document) {
        document.setVehicle(this);
        documents.add(document);
    }
}
