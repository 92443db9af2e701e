package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.moveinsync.fleetcompliance.service.TestDocuments.*;
import static org.assertj.core.api.Assertions.*;

class LatestDocumentSelectorTest {

    private final LatestDocumentSelector selector = new LatestDocumentSelector();

    @Test
    @DisplayName("Furthest expiry wins even when an older scan is uploaded later")
    void furthestExpiryWins() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        VehicleDocument renewal = add(vehicle, 1L, DocumentType.INSURANCE, "INS-NEW", TODAY.plusDays(300));
        add(vehicle, 2L, DocumentType.INSURANCE, "INS-OLD", TODAY.minusDays(60));

        assertThat(selector.latestFor(vehicle, DocumentType.INSURANCE, null)).contains(renewal);
    }

    @Test
    @DisplayName("Same expiry date: the most recent upload wins")
    void sameExpiry_latestUploadWins() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        VehicleDocument first = add(vehicle, 1L, DocumentType.PERMIT, "NP-1", TODAY.plusDays(90));
        VehicleDocument corrected = add(vehicle, 2L, DocumentType.PERMIT, "NP-1A", TODAY.plusDays(90));

        assertThat(selector.latestFor(vehicle, DocumentType.PERMIT, null)).contains(corrected);

        // Upload order, not id order, decides
        first.setUploadedAt(LocalDateTime.of(2026, 6, 1, 0, 0));
        assertThat(selector.latestFor(vehicle, DocumentType.PERMIT, null)).contains(first);
    }

    @Test
    @DisplayName("Documents without expiry never govern")
    void noExpiry_neverGoverns() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        add(vehicle, 1L, DocumentType.FITNESS_CERTIFICATE, "FC-1", null);

        assertThat(selector.latestFor(vehicle, DocumentType.FITNESS_CERTIFICATE, null)).isEmpty();
        assertThat(selector.trackedObligations(vehicle))
                .containsExactly(DocumentObligation.of(DocumentType.FITNESS_CERTIFICATE, null));
    }

    @Test
    @DisplayName("OTHER documents are distinguished by their custom name")
    void other_keyedByCustomName() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        VehicleDocument fire = add(vehicle, 1L, DocumentType.OTHER, "Fire Safety", "FS-1", TODAY.plusDays(10));
        VehicleDocument gps = add(vehicle, 2L, DocumentType.OTHER, "GPS Calibration", "GPS-1", TODAY.plusDays(200));

        assertThat(selector.latestFor(vehicle, DocumentType.OTHER, "Fire Safety")).contains(fire);
        assertThat(selector.latestFor(vehicle, DocumentType.OTHER, "GPS Calibration")).contains(gps);
        assertThat(selector.latestFor(vehicle, DocumentType.OTHER, "Tachograph")).isEmpty();
    }

    @Test
    @DisplayName("Custom name is ignored for non-OTHER kinds")
    void customName_ignoredForStandardKinds() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        VehicleDocument insurance = add(vehicle, 1L, DocumentType.INSURANCE, "INS-1", TODAY.plusDays(50));

        assertThat(selector.latestFor(vehicle, DocumentType.INSURANCE, "whatever")).contains(insurance);
    }

    @Test
    @DisplayName("Tracked obligations follow document-type order, one per custom name")
    void trackedObligations_order() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");
        add(vehicle, 1L, DocumentType.OTHER, "Fire Safety", "FS-1", TODAY.plusDays(10));
        add(vehicle, 2L, DocumentType.POLLUTION_CERTIFICATE, "PUC-1", TODAY.plusDays(10));
        add(vehicle, 3L, DocumentType.INSURANCE, "INS-1", TODAY.plusDays(10));
        add(vehicle, 4L, DocumentType.INSURANCE, "INS-2", TODAY.plusDays(20));

        assertThat(selector.trackedObligations(vehicle)).containsExactly(
                DocumentObligation.of(DocumentType.INSURANCE, null),
                DocumentObligation.of(DocumentType.POLLUTION_CERTIFICATE, null),
                DocumentObligation.of(DocumentType.OTHER, "Fire Safety"));
    }

    @Test
    @DisplayName("A vehicle without documents tracks nothing")
    void emptyHistory() {
        Vehicle vehicle = vehicle(1L, "KA01AB1234");

        assertThat(selector.trackedObligations(vehicle)).isEmpty();
        assertThat(selector.latestFor(vehicle, DocumentType.INSURANCE, null)).isEmpty();
    }
}
