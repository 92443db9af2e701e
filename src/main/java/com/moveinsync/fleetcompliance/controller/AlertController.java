package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.AlertResponse;
import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.FleetSyncResult;
import com.moveinsync.fleetcompliance.service.AlertService;
import com.moveinsync.fleetcompliance.service.FleetAlertSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert inbox of the caller (X-User-Id).
 *
 * Endpoints:
 *  GET  /api/alerts?unreadOnly=true   newest first
 *  GET  /api/alerts/unread-count      badge counter
 *  POST /api/alerts/{id}/read         acknowledge one alert
 *  POST /api/alerts/sync              refresh the caller's alerts for the whole fleet
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertService alertService;
    private final FleetAlertSyncService fleetAlertSyncService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<AlertResponse>>> listAlerts(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(value = "unreadOnly", defaultValue = "false") boolean unreadOnly) {
        List<AlertResponse> alerts = alertService.list(userId, unreadOnly);
        return ResponseEntity.ok(ApiResponse.ok(alerts, "Found " + alerts.size() + " alert(s)"));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> unreadCount(@RequestHeader("X-User-Id") String userId) {
        long count = alertService.unreadCount(userId);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("unread", count), count + " unread alert(s)"));
    }

    /**
     * POST /api/alerts/{id}/read
     *
     * Only the owner can acknowledge an alert; another user's alert answers 404.
     * A read alert is never raised again for the same document.
     */
    @PostMapping("/{id}/read")
    public ResponseEntity<ApiResponse<Void>> markRead(
            @PathVariable Long id,
            @RequestHeader("X-User-Id") String userId) {
        if (!alertService.markRead(id, userId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Alert not found: " + id));
        }
        return ResponseEntity.ok(ApiResponse.ok("Alert #" + id + " marked as read"));
    }

    @PostMapping("/sync")
    public ResponseEntity<ApiResponse<FleetSyncResult>> synchronize(@RequestHeader("X-User-Id") String userId) {
        log.info("ALERT API: Fleet sync requested by '{}'", userId);
        FleetSyncResult result = fleetAlertSyncService.synchronizeAll(userId);
        String message = result.getFailedVehicles() == 0
                ? "Synchronized " + result.getSynchronizedVehicles() + " vehicle(s)"
                : "Synchronized " + result.getSynchronizedVehicles() + " vehicle(s), "
                        + result.getFailedVehicles() + " failed";
        return ResponseEntity.ok(ApiResponse.ok(result, message));
    }
}
