package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.DocumentResponse;
import com.moveinsync.fleetcompliance.dto.DocumentUploadRequest;
import com.moveinsync.fleetcompliance.dto.VehicleDetailsResponse;
import com.moveinsync.fleetcompliance.dto.VehicleRequest;
import com.moveinsync.fleetcompliance.dto.VehicleResponse;
import com.moveinsync.fleetcompliance.service.DocumentService;
import com.moveinsync.fleetcompliance.service.VehicleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Vehicle registry and document upload.
 *
 * Endpoints:
 *  GET    /api/vehicles                              list with overall status
 *  GET    /api/vehicles/{id}                         details, obligations, document history
 *  POST   /api/vehicles                              register a vehicle
 *  PUT    /api/vehicles/{id}                         edit a vehicle
 *  DELETE /api/vehicles/{id}                         delete with documents and alerts
 *  GET    /api/vehicles/type-suggestions             suggested vehicle types
 *  POST   /api/vehicles/{id}/documents               upload a document instance
 *  GET    /api/vehicles/{id}/documents/latest        governing document of one kind
 *
 * Mutations require the acting user in X-User-Id.
 */
@RestController
@RequestMapping("/api/vehicles")
@RequiredArgsConstructor
@Slf4j
public class VehicleController {

    private final VehicleService vehicleService;
    private final DocumentService documentService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<VehicleResponse>>> listVehicles() {
        List<VehicleResponse> vehicles = vehicleService.list();
        return ResponseEntity.ok(ApiResponse.ok(vehicles, "Found " + vehicles.size() + " vehicle(s)"));
    }

    @GetMapping("/type-suggestions")
    public ResponseEntity<ApiResponse<List<String>>> typeSuggestions() {
        return ResponseEntity.ok(ApiResponse.ok(vehicleService.suggestedVehicleTypes(), "Suggested vehicle types"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<VehicleDetailsResponse>> getVehicle(@PathVariable Long id) {
        Optional<VehicleDetailsResponse> details = vehicleService.details(id);
        return details
                .map(d -> ResponseEntity.ok(ApiResponse.ok(d, "Vehicle " + d.getVehicle().getRegistrationNumber())))
                .orElseGet(() -> notFound("Vehicle not found: " + id));
    }

    /**
     * POST /api/vehicles
     *
     * Registration is stored trimmed and upper-cased; a duplicate is rejected with 400.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<VehicleResponse>> createVehicle(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody VehicleRequest request) {
        log.info("VEHICLE API: POST by '{}' for {}", userId, request.getRegistrationNumber());
        VehicleResponse created = vehicleService.create(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Vehicle " + created.getRegistrationNumber() + " created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<VehicleResponse>> updateVehicle(
            @PathVariable Long id,
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody VehicleRequest request) {
        log.info("VEHICLE API: PUT #{} by '{}'", id, userId);
        return vehicleService.update(id, request, userId)
                .map(v -> ResponseEntity.ok(ApiResponse.ok(v, "Vehicle " + v.getRegistrationNumber() + " updated")))
                .orElseGet(() -> notFound("Vehicle not found: " + id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteVehicle(
            @PathVariable Long id,
            @RequestHeader("X-User-Id") String userId) {
        log.info("VEHICLE API: DELETE #{} by '{}'", id, userId);
        if (!vehicleService.delete(id, userId)) {
            return notFound("Vehicle not found: " + id);
        }
        return ResponseEntity.ok(ApiResponse.ok("Vehicle #" + id + " deleted"));
    }

    /**
     * POST /api/vehicles/{id}/documents
     *
     * Appends a new document (renewals never overwrite history), then refreshes the
     * uploader's alerts for the vehicle. AI suggestions are stored for comparison only.
     */
    @PostMapping("/{id}/documents")
    public ResponseEntity<ApiResponse<DocumentResponse>> uploadDocument(
            @PathVariable Long id,
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody DocumentUploadRequest request) {
        log.info("VEHICLE API: Document upload for #{} by '{}', type: {}", id, userId, request.getDocumentType());
        return documentService.upload(id, request, userId)
                .map(d -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.ok(d, d.getDisplayName() + " uploaded, status: " + d.getStatus())))
                .orElseGet(() -> notFound("Vehicle not found: " + id));
    }

    /**
     * GET /api/vehicles/{id}/documents/latest?type=OTHER&customTypeName=Fire%20Safety
     */
    @GetMapping("/{id}/documents/latest")
    public ResponseEntity<ApiResponse<DocumentResponse>> latestDocument(
            @PathVariable Long id,
            @RequestParam("type") String type,
            @RequestParam(value = "customTypeName", required = false) String customTypeName) {
        return documentService.latest(id, type, customTypeName)
                .map(d -> ResponseEntity.ok(ApiResponse.ok(d, "Governing " + d.getDisplayName() + " document")))
                .orElseGet(() -> notFound("No " + type + " document with an expiry date for vehicle #" + id));
    }

    private static <T> ResponseEntity<ApiResponse<T>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(message));
    }
}
