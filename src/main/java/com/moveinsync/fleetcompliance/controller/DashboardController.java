package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.ComplianceSummary;
import com.moveinsync.fleetcompliance.service.ComplianceSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final ComplianceSummaryService summaryService;

    /**
     * GET /api/dashboard/summary
     *
     * Computed on every call from current documents and today's date.
     */
    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<ComplianceSummary>> summary() {
        ComplianceSummary summary = summaryService.summarizeFleet();
        return ResponseEntity.ok(ApiResponse.ok(summary,
                summary.getCompliantVehicles() + " of " + summary.getTotalVehicles() + " vehicle(s) compliant"));
    }
}
