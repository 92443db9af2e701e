package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleComplianceStatus;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the governing document of every tracked obligation into one vehicle verdict.
 *
 * evaluate() is the single place obligation statuses are computed; the alert
 * synchronizer, the summary and the vehicle detail view all go through it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VehicleComplianceAggregator {

    private final LatestDocumentSelector documentSelector;
    private final ComplianceClassifier classifier;

    /**
     * Resolves and classifies the governing document of each tracked obligation.
     *
     * @return one entry per tracked obligation, in LatestDocumentSelector.trackedObligations order
     */
    public List<ObligationStatus> evaluate(Vehicle vehicle) {
        List<ObligationStatus> result = new ArrayList<>();
        for (DocumentObligation obligation : documentSelector.trackedObligations(vehicle)) {
            VehicleDocument governing = documentSelector.latestFor(vehicle, obligation).orElse(null);
            DocumentStatus status = governing != null
                    ? classifier.classify(governing.getExpiryDate())
                    : DocumentStatus.MISSING;
            result.add(new ObligationStatus(obligation, governing, status));
        }
        return result;
    }

    public VehicleComplianceStatus overallStatus(Vehicle vehicle) {
        return overallStatus(vehicle, evaluate(vehicle));
    }

    /**
     * Precedence: OVERDUE wins over EXPIRING_SOON; MISSING_INFO is only considered
     * when neither applies, so a vehicle both overdue on one document and missing an
     * essential one reports OVERDUE.
     */
    public VehicleComplianceStatus overallStatus(Vehicle vehicle, List<ObligationStatus> statuses) {
        boolean expiringSoon = false;
        for (ObligationStatus s : statuses) {
            if (s.getStatus() == DocumentStatus.OVERDUE) {
                return VehicleComplianceStatus.OVERDUE;
            }
            if (s.getStatus() == DocumentStatus.EXPIRING_SOON) {
                expiringSoon = true;
            }
        }
        if (expiringSoon) {
            return VehicleComplianceStatus.EXPIRING_SOON;
        }

        // Essential kinds count even when never uploaded
        for (DocumentType essential : DocumentType.essentialTypes()) {
            boolean governed = statuses.stream()
                    .anyMatch(s -> s.getObligation().getDocumentType() == essential
                            && s.getGoverningDocument() != null);
            if (!governed) {
                log.debug("Vehicle {} has no governing {} document: MISSING_INFO",
                        vehicle.getRegistrationNumber(), essential);
                return VehicleComplianceStatus.MISSING_INFO;
            }
        }
        return VehicleComplianceStatus.COMPLIANT;
    }
}
