package com.moveinsync.fleetcompliance.config;

import com.moveinsync.fleetcompliance.dto.DocumentUploadRequest;
import com.moveinsync.fleetcompliance.dto.SuggestedField;
import com.moveinsync.fleetcompliance.dto.VehicleRequest;
import com.moveinsync.fleetcompliance.dto.VehicleResponse;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import com.moveinsync.fleetcompliance.service.AuditService;
import com.moveinsync.fleetcompliance.service.DocumentService;
import com.moveinsync.fleetcompliance.service.VehicleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data loader that runs on application startup.
 * Registers a small sample fleet with document history (dates relative to today)
 * so every compliance status shows up on the dashboard:
 *
 *   MH12AB1234  Car    pollution certificate expiring soon, insurance renewed after lapsing
 *   KA01CD5678  Truck  insurance overdue
 *   DL03EF9012  Bus    compliant, custom fire safety certificate expiring soon
 *   TN07GH4567  Van    only insurance on file → MISSING_INFO
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final VehicleRepository vehicleRepository;
    private final VehicleService vehicleService;
    private final DocumentService documentService;
    private final AuditService auditService;
    private final Clock clock;

    @Value("${fleet.seed.enabled:false}")
    private boolean enabled;

    @Value("${fleet.seed.user-id:system}")
    private String seedUserId;

    @Override
    public void run(String... args) {
        if (!enabled) {
            log.info("Sample fleet disabled (fleet.seed.enabled=false)");
            return;
        }
        // Check if data already exists to avoid duplicates
        if (vehicleRepository.count() > 0) {
            log.info("Data already exists, skipping initialization");
            return;
        }
        log.info("Starting data initialization as '{}'...", seedUserId);
        LocalDate today = LocalDate.now(clock);

        Long car = vehicle("MH12AB1234", "Toyota", "Camry", "Car");
        upload(car, DocumentType.INSURANCE, null, "INS-88120", today.minusYears(1).minusDays(60), today.minusDays(60));
        upload(car, DocumentType.INSURANCE, null, "INS-90415", today.minusDays(55), today.plusDays(310));
        upload(car, DocumentType.FITNESS_CERTIFICATE, null, "FC-22017", today.minusDays(165), today.plusDays(200));
        upload(car, DocumentType.POLLUTION_CERTIFICATE, null, "PUC-5521", today.minusDays(168), today.plusDays(12));

        Long truck = vehicle("KA01CD5678", "Volvo", "FH", "Truck");
        upload(truck, DocumentType.INSURANCE, null, "INS-77310", today.minusDays(370), today.minusDays(5));
        upload(truck, DocumentType.FITNESS_CERTIFICATE, null, "FC-31002", today.minusDays(30), today.plusDays(335));
        upload(truck, DocumentType.POLLUTION_CERTIFICATE, null, "PUC-7740", today.minusDays(40), today.plusDays(140));
        upload(truck, DocumentType.PERMIT, null, "NP-2026-118", today.minusDays(65), today.plusDays(300));

        Long bus = vehicle("DL03EF9012", "Tata", "Marcopolo", "Bus");
        upload(bus, DocumentType.INSURANCE, null, "INS-66004", today.minusDays(100), today.plusDays(265));
        upload(bus, DocumentType.FITNESS_CERTIFICATE, null, "FC-40911", today.minusDays(200), today.plusDays(165));
        upload(bus, DocumentType.POLLUTION_CERTIFICATE, null, "PUC-9902", today.minusDays(90), today.plusDays(90));
        upload(bus, DocumentType.OTHER, "Fire Safety Certificate", "FS-1203", today.minusDays(345), today.plusDays(20));

        Long van = vehicle("TN07GH4567", "Force", "Traveller", "Van");
        upload(van, DocumentType.INSURANCE, null, "INS-51877", today.minusDays(10), today.plusDays(355));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("vehicles", vehicleRepository.count());
        details.put("seedDate", today.toString());
        auditService.record(seedUserId, AuditAction.SYSTEM_INIT, AuditEntityType.SYSTEM, null, details, null);

        log.info("=== Data initialization completed successfully ===");
        log.info("Sample fleet: MH12AB1234, KA01CD5678, DL03EF9012, TN07GH4567 (alerts owned by '{}')", seedUserId);
    }

    private Long vehicle(String registration, String make, String model, String type) {
        VehicleResponse created = vehicleService.create(
                new VehicleRequest(registration, make, model, type), seedUserId);
        log.info("Vehicle created: {} ({} {})", created.getRegistrationNumber(), make, model);
        return created.getId();
    }

    private void upload(Long vehicleId, DocumentType type, String customName, String reference,
                        LocalDate start, LocalDate expiry) {
        DocumentUploadRequest request = DocumentUploadRequest.builder()
                .documentType(type.name())
                .customTypeName(customName)
                .policyNumber(reference)
                .startDate(start.toString())
                .expiryDate(expiry.toString())
                .documentName(reference + ".pdf")
                .aiPolicyNumber(new SuggestedField(reference, 0.93))
                .aiExpiryDate(new SuggestedField(expiry.toString(), 0.88))
                .build();
        documentService.upload(vehicleId, request, seedUserId);
    }
}
