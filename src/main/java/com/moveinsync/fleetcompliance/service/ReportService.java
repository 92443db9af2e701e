package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.ExpiringDocumentsFilter;
import com.moveinsync.fleetcompliance.dto.ReportableDocument;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expiring-documents report: every document of every vehicle (full history, not
 * only governing ones) with its status as of today.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    /** Documents without expiry first, then most urgent; registration breaks ties */
    private static final Comparator<ReportableDocument> REPORT_ORDER =
            Comparator.comparing(ReportableDocument::getDaysDifference, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(ReportableDocument::getVehicleRegistration)
                    .thenComparing(ReportableDocument::getDocumentId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final VehicleRepository vehicleRepository;
    private final ComplianceClassifier classifier;
    private final AuditService auditService;

    @Transactional(readOnly = true)
    public List<ReportableDocument> expiringDocuments(ExpiringDocumentsFilter filter, String userId) {
        ExpiringDocumentsFilter criteria = filter != null ? filter : new ExpiringDocumentsFilter();

        List<ReportableDocument> rows = new ArrayList<>();
        for (Vehicle vehicle : vehicleRepository.findAllWithDocuments()) {
            for (VehicleDocument document : vehicle.getDocuments()) {
                if (!criteria.acceptsType(document.getDocumentType())) {
                    continue;
                }
                DocumentStatus status = classifier.classify(document.getExpiryDate());
                if (!criteria.acceptsStatus(status)) {
                    continue;
                }
                rows.add(toRow(vehicle, document, status));
            }
        }
        rows.sort(REPORT_ORDER);

        log.info("REPORT: Expiring documents viewed by '{}', {} row(s), filter: {}", userId, rows.size(), criteria);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("report", "expiring-documents");
        details.put("statuses", criteria.getStatuses() != null
                ? criteria.getStatuses().stream().map(Enum::name).sorted().toList() : List.of());
        details.put("documentTypes", criteria.getDocumentTypes() != null
                ? criteria.getDocumentTypes().stream().map(Enum::name).sorted().toList() : List.of());
        details.put("rowCount", rows.size());
        auditService.record(userId, AuditAction.VIEW_REPORT, AuditEntityType.REPORT, null, details, null);
        return rows;
    }

    /** The export itself happens client-side; only the access is recorded */
    public void recordExport(String reportName, String format, Map<String, Object> filters, String userId) {
        String normalizedFormat = format.trim().toUpperCase(Locale.ROOT);
        log.info("REPORT: '{}' exported as {} by '{}'", reportName, normalizedFormat, userId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("report", reportName);
        details.put("format", normalizedFormat);
        details.put("filters", filters != null ? filters : Map.of());
        auditService.record(userId, AuditAction.EXPORT_REPORT, AuditEntityType.REPORT, null, details, null);
    }

    private ReportableDocument toRow(Vehicle vehicle, VehicleDocument document, DocumentStatus status) {
        return ReportableDocument.builder()
                .documentId(document.getId())
                .vehicleId(vehicle.getId())
                .vehicleRegistration(vehicle.getRegistrationNumber())
                .vehicleType(vehicle.getVehicleType())
                .documentType(document.getDocumentType())
                .customTypeName(document.getCustomTypeName())
                .displayName(document.getDisplayName())
                .policyNumber(document.getPolicyNumber())
                .startDate(document.getStartDate())
                .expiryDate(document.getExpiryDate())
                .uploadedAt(document.getUploadedAt())
                .status(status)
                .daysDifference(classifier.daysRemaining(document.getExpiryDate()))
                .build();
    }
}
