package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.DocumentResponse;
import com.moveinsync.fleetcompliance.dto.DocumentUploadRequest;
import com.moveinsync.fleetcompliance.dto.VehicleRequest;
import com.moveinsync.fleetcompliance.dto.VehicleResponse;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.VehicleComplianceStatus;
import com.moveinsync.fleetcompliance.service.DocumentService;
import com.moveinsync.fleetcompliance.service.VehicleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VehicleController: status codes and envelope contents.
 */
@ExtendWith(MockitoExtension.class)
class VehicleControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private VehicleService  vehicleService;
    @Mock private DocumentService documentService;

    @InjectMocks
    private VehicleController vehicleController;

    private static final String USER = "ops-lead";

    @Test
    @DisplayName("POST /api/vehicles → 201 with the normalized vehicle")
    void create_returnsCreated() {
        VehicleRequest request = new VehicleRequest("ka01ab1234", "Tata", "Ace", "Truck");
        when(vehicleService.create(request, USER)).thenReturn(VehicleResponse.builder()
                .id(7L).registrationNumber("KA01AB1234").overallStatus(VehicleComplianceStatus.MISSING_INFO).build());

        ResponseEntity<ApiResponse<VehicleResponse>> response = vehicleController.createVehicle(USER, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData().getRegistrationNumber()).isEqualTo("KA01AB1234");
    }

    @Test
    @DisplayName("PUT /api/vehicles/{id} for unknown vehicle → 404 error envelope")
    void update_unknown_notFound() {
        when(vehicleService.update(eq(99L), any(), eq(USER))).thenReturn(Optional.empty());

        ResponseEntity<ApiResponse<VehicleResponse>> response = vehicleController.updateVehicle(
                99L, USER, new VehicleRequest("KA01AB1234", "Tata", "Ace", "Truck"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getMessage()).contains("99");
    }

    @Test
    @DisplayName("DELETE /api/vehicles/{id} → 200 when deleted, 404 when unknown")
    void delete_statusCodes() {
        when(vehicleService.delete(7L, USER)).thenReturn(true);
        when(vehicleService.delete(99L, USER)).thenReturn(false);

        assertThat(vehicleController.deleteVehicle(7L, USER).getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(vehicleController.deleteVehicle(99L, USER).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("POST /api/vehicles/{id}/documents → 201 with computed status")
    void upload_returnsCreated() {
        DocumentUploadRequest request = DocumentUploadRequest.builder()
                .documentType("INSURANCE").expiryDate("2026-11-02").build();
        when(documentService.upload(7L, request, USER)).thenReturn(Optional.of(DocumentResponse.builder()
                .id(42L).documentType(DocumentType.INSURANCE).displayName("Insurance")
                .status(DocumentStatus.EXPIRING_SOON).build()));

        ResponseEntity<ApiResponse<DocumentResponse>> response = vehicleController.uploadDocument(7L, USER, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().getMessage()).isEqualTo("Insurance uploaded, status: EXPIRING_SOON");
    }

    @Test
    @DisplayName("GET latest document with no governing document → 404")
    void latest_none_notFound() {
        when(documentService.latest(7L, "PERMIT", null)).thenReturn(Optional.empty());

        assertThat(vehicleController.latestDocument(7L, "PERMIT", null).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }
}
