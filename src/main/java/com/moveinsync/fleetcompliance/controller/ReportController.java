package com.moveinsync.fleetcompliance.controller;

import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.ExpiringDocumentsFilter;
import com.moveinsync.fleetcompliance.dto.ExportReportRequest;
import com.moveinsync.fleetcompliance.dto.ReportableDocument;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.service.ReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

/**
 * Compliance reports. Every access is audited.
 *
 * Endpoints:
 *  GET  /api/reports/expiring-documents?statuses=OVERDUE,EXPIRING_SOON&documentTypes=INSURANCE
 *  POST /api/reports/exports
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/expiring-documents")
    public ResponseEntity<ApiResponse<List<ReportableDocument>>> expiringDocuments(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(value = "statuses", required = false) Set<DocumentStatus> statuses,
            @RequestParam(value = "documentTypes", required = false) Set<DocumentType> documentTypes) {
        ExpiringDocumentsFilter filter = ExpiringDocumentsFilter.builder()
                .statuses(statuses)
                .documentTypes(documentTypes)
                .build();
        List<ReportableDocument> rows = reportService.expiringDocuments(filter, userId);
        return ResponseEntity.ok(ApiResponse.ok(rows, "Found " + rows.size() + " document(s)"));
    }

    @PostMapping("/exports")
    public ResponseEntity<ApiResponse<Void>> recordExport(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody ExportReportRequest request) {
        reportService.recordExport(request.getReportName(), request.getFormat(), request.getFilters(), userId);
        return ResponseEntity.ok(ApiResponse.ok("Export of '" + request.getReportName() + "' recorded"));
    }
}
