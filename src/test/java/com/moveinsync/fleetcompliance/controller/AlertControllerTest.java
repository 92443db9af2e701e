package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.FleetSyncResult;
import com.moveinsync.fleetcompliance.service.AlertService;
import com.moveinsync.fleetcompliance.service.FleetAlertSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    @Mock private AlertService          alertService;
    @Mock private FleetAlertSyncService fleetAlertSyncService;

    @InjectMocks
    private AlertController alertController;

    @Test
    @DisplayName("Marking another owner's alert → 404")
    void markRead_foreignAlert_notFound() {
        when(alertService.markRead(5L, "intruder")).thenReturn(false);

        ResponseEntity<ApiResponse<Void>> response = alertController.markRead(5L, "intruder");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Marking own alert → 200")
    void markRead_ownAlert_ok() {
        when(alertService.markRead(5L, "ops-lead")).thenReturn(true);

        assertThat(alertController.markRead(5L, "ops-lead").getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    @DisplayName("Unread count is wrapped in the envelope")
    void unreadCount() {
        when(alertService.unreadCount("ops-lead")).thenReturn(3L);

        ResponseEntity<ApiResponse<Map<String, Long>>> response = alertController.unreadCount("ops-lead");

        assertThat(response.getBody().getData()).containsEntry("unread", 3L);
    }

    @Test
    @DisplayName("Fleet sync reports failed vehicles in the message")
    void sync_reportsFailures() {
        when(fleetAlertSyncService.synchronizeAll("ops-lead")).thenReturn(FleetSyncResult.builder()
                .ownerId("ops-lead").totalVehicles(4).synchronizedVehicles(3)
                .failedVehicleIds(List.of(9L)).unreadAlerts(2).build());

        ResponseEntity<ApiResponse<FleetSyncResult>> response = alertController.synchronize("ops-lead");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("Synchronized 3 vehicle(s), 1 failed");
        assertThat(response.getBody().getData().getFailedVehicleIds()).containsExactly(9L);
    }
}
