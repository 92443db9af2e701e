package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.ComplianceBreakdown;
import com.moveinsync.fleetcompliance.dto.ComplianceSummary;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleComplianceStatus;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard figures for the fleet. Always computed from current documents, never cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceSummaryService {

    private final VehicleRepository vehicleRepository;
    private final VehicleComplianceAggregator aggregator;

    @Transactional(readOnly = true)
    public ComplianceSummary summarizeFleet() {
        return summarize(vehicleRepository.findAllWithDocuments());
    }

    public ComplianceSummary summarize(List<Vehicle> fleet) {
        Map<VehicleComplianceStatus, Long> byVerdict = new EnumMap<>(VehicleComplianceStatus.class);
        Map<DocumentType, Long> expiring = zeroPerKind();
        Map<DocumentType, Long> overdue = zeroPerKind();
        long expiringDocuments = 0;
        long overdueDocuments = 0;

        for (Vehicle vehicle : fleet) {
            List<ObligationStatus> statuses = aggregator.evaluate(vehicle);
            byVerdict.merge(aggregator.overallStatus(vehicle, statuses), 1L, Long::sum);

            for (ObligationStatus status : statuses) {
                DocumentType kind = status.getObligation().getDocumentType();
                if (status.getStatus() == DocumentStatus.EXPIRING_SOON) {
                    expiring.merge(kind, 1L, Long::sum);
                    expiringDocuments++;
                } else if (status.getStatus() == DocumentStatus.OVERDUE) {
                    overdue.merge(kind, 1L, Long::sum);
                    overdueDocuments++;
                }
            }
        }

        long compliant = byVerdict.getOrDefault(VehicleComplianceStatus.COMPLIANT, 0L);
        ComplianceBreakdown breakdown = new ComplianceBreakdown(
                compliant,
                byVerdict.getOrDefault(VehicleComplianceStatus.EXPIRING_SOON, 0L),
                byVerdict.getOrDefault(VehicleComplianceStatus.OVERDUE, 0L),
                byVerdict.getOrDefault(VehicleComplianceStatus.MISSING_INFO, 0L),
                fleet.size());

        log.debug("SUMMARY: {} vehicle(s), {} compliant, {} expiring / {} overdue document(s)",
                fleet.size(), compliant, expiringDocuments, overdueDocuments);

        return ComplianceSummary.builder()
                .totalVehicles(fleet.size())
                .compliantVehicles(compliant)
                .expiringSoonDocuments(expiringDocuments)
                .overdueDocuments(overdueDocuments)
                .perKindExpiring(Collections.unmodifiableMap(expiring))
                .perKindOverdue(Collections.unmodifiableMap(overdue))
                .complianceBreakdown(breakdown)
                .build();
    }

    private static Map<DocumentType, Long> zeroPerKind() {
        Map<DocumentType, Long> counts = new EnumMap<>(DocumentType.class);
        for (DocumentType type : DocumentType.values()) {
            counts.put(type, 0L);
        }
        return counts;
    }
}
