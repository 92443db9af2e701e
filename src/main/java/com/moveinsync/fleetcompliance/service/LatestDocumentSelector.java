package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the governing document for one tracked obligation out of a vehicle's history.
 *
 * Only documents with an expiry date compete. The one expiring furthest in the
 * future wins, ties broken by the most recent upload. An old, already-expired scan
 * uploaded late therefore never overrides a newer valid one, and a fresh renewal
 * immediately supersedes an about-to-expire document.
 */
@Component
public class LatestDocumentSelector {

    private static final Comparator<VehicleDocument> GOVERNING_ORDER =
            Comparator.comparing(VehicleDocument::getExpiryDate)
                    .thenComparing(VehicleDocument::getUploadedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(VehicleDocument::getId,
                            Comparator.nullsFirst(Comparator.naturalOrder()));

    public Optional<VehicleDocument> latestFor(Vehicle vehicle, DocumentType documentType, String customTypeName) {
        return latestFor(vehicle, DocumentObligation.of(documentType, customTypeName));
    }

    public Optional<VehicleDocument> latestFor(Vehicle vehicle, DocumentObligation obligation) {
        return documentsOf(vehicle).stream()
                .filter(obligation::matches)
                .filter(d -> d.getExpiryDate() != null)
                .max(GOVERNING_ORDER);
    }

    /**
     * Obligations the vehicle has at least one document for, in document-type order
     * then first-upload order for OTHER custom names.
     */
    public Set<DocumentObligation> trackedObligations(Vehicle vehicle) {
        Set<DocumentObligation> tracked = new LinkedHashSet<>();
        List<VehicleDocument> documents = documentsOf(vehicle);
        for (DocumentType type : DocumentType.values()) {
            documents.stream()
                    .filter(d -> d.getDocumentType() == type)
                    .map(DocumentObligation::of)
                    .forEach(tracked::add);
        }
        return tracked;
    }

    private List<VehicleDocument> documentsOf(Vehicle vehicle) {
        return vehicle.getDocuments() != null ? vehicle.getDocuments() : List.of();
    }
}
