package com.moveinsync.fleetcompliance.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.moveinsync.fleetcompliance.dto.ApiResponse;
import com.moveinsync.fleetcompliance.dto.AuditLogFilter;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.AuditLogEntry;
import com.moveinsync.fleetcompliance.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AuditController: Audit & Compliance REST API
 *
 * Read-only access to the audit trail. Entries outlive the entities they describe,
 * so the history of a deleted vehicle is still available.
 *
 * Endpoints:
 *  GET /api/audit?userId=&entityType=&action=&from=&to=   filtered listing, newest first
 *  GET /api/audit/{entityType}/{entityId}                 history of one entity
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditService auditService;
    private final ObjectMapper objectMapper;

    /**
     * GET /api/audit?entityType=VEHICLE&from=2026-10-01&to=2026-10-19
     *
     * Dates are YYYY-MM-DD and inclusive; an inverted range answers 400.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> search(
            @RequestParam(value = "userId", required = false) String userId,
            @RequestParam(value = "entityType", required = false) AuditEntityType entityType,
            @RequestParam(value = "action", required = false) AuditAction action,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        AuditLogFilter filter = AuditLogFilter.builder()
                .userId(userId)
                .entityType(entityType)
                .action(action)
                .from(from)
                .to(to)
                .build();
        log.info("AUDIT API: GET entries, {}", filter);
        List<AuditLogEntry> entries = auditService.search(filter);
        return ResponseEntity.ok(ApiResponse.ok(toResponseList(entries),
                "Found " + entries.size() + " audit entr(ies)"));
    }

    @GetMapping("/{entityType}/{entityId}")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> history(
            @PathVariable AuditEntityType entityType,
            @PathVariable String entityId) {
        log.info("AUDIT API: GET history of {} #{}", entityType, entityId);
        List<AuditLogEntry> entries = auditService.historyForEntity(entityType, entityId);
        return ResponseEntity.ok(ApiResponse.ok(toResponseList(entries),
                "Found " + entries.size() + " audit entr(ies) for " + entityType + " #" + entityId));
    }

    /**
     * Converts entries to response maps, inlining the stored details JSON as an object.
     */
    private List<Map<String, Object>> toResponseList(List<AuditLogEntry> entries) {
        return entries.stream().map(e -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",                 e.getId());
            m.put("timestamp",          e.getTimestamp() != null ? e.getTimestamp().toString() : null);
            m.put("userId",             e.getUserId());
            m.put("action",             e.getAction().name());
            m.put("entityType",         e.getEntityType().name());
            m.put("entityId",           e.getEntityId());
            m.put("entityRegistration", e.getEntityRegistration());
            m.put("details",            readDetails(e));
            return m;
        }).toList();
    }

    private Object readDetails(AuditLogEntry entry) {
        if (entry.getDetails() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(entry.getDetails());
        } catch (JsonProcessingException e) {
            log.warn("AUDIT API: Entry #{} has non-JSON details, returned as text", entry.getId());
            return entry.getDetails();
        }
    }
}
