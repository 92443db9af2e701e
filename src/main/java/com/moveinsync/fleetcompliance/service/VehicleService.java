package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.DocumentResponse;
import com.moveinsync.fleetcompliance.dto.ObligationStatusResponse;
import com.moveinsync.fleetcompliance.dto.VehicleDetailsResponse;
import com.moveinsync.fleetcompliance.dto.VehicleRequest;
import com.moveinsync.fleetcompliance.dto.VehicleResponse;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import com.moveinsync.fleetcompliance.exception.ValidationException;
import com.moveinsync.fleetcompliance.repository.AlertRepository;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * VehicleService: fleet registry.
 *
 * Every mutation:
 *  1. validates and normalizes input before touching the store
 *  2. runs in one transaction, holding the vehicle's row lock for updates/deletes
 *  3. writes an audit entry (best effort, see AuditService)
 *  4. is retried on transient store failures (retry wraps the transaction)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VehicleService {

    /** Offered by the UI; vehicleType stays free text */
    public static final List<String> SUGGESTED_VEHICLE_TYPES =
            List.of("Car", "Truck", "Bus", "Van", "Motorcycle", "Other");

    private static final Comparator<VehicleDocument> HISTORY_ORDER =
            Comparator.comparing(VehicleDocument::getDocumentType)
                    .thenComparing(VehicleDocument::getUploadedAt,
                            Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
                    .thenComparing(VehicleDocument::getId,
                            Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    private final VehicleRepository vehicleRepository;
    private final AlertRepository alertRepository;
    private final VehicleComplianceAggregator aggregator;
    private final ComplianceClassifier classifier;
    private final AlertSynchronizer alertSynchronizer;
    private final AuditService auditService;
    private final Clock clock;

    // ── Mutations ──────────────────────────────────────────────────────────────

    /**
     * @throws ValidationException blank registration or registration already registered
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public VehicleResponse create(VehicleRequest request, String userId) {
        String registration = normalizeRegistration(request.getRegistrationNumber());
        if (vehicleRepository.existsByRegistrationNumber(registration)) {
            log.warn("VEHICLE: Rejected create, registration {} already exists", registration);
            throw new ValidationException("registrationNumber",
                    "A vehicle with registration " + registration + " already exists");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Vehicle vehicle = vehicleRepository.save(Vehicle.builder()
                .registrationNumber(registration)
                .make(trimToNull(request.getMake()))
                .model(trimToNull(request.getModel()))
                .vehicleType(trimToNull(request.getVehicleType()))
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("VEHICLE: Created #{} ({}) by '{}'", vehicle.getId(), registration, userId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("registrationNumber", registration);
        details.put("make", vehicle.getMake());
        details.put("model", vehicle.getModel());
        details.put("vehicleType", vehicle.getVehicleType());
        auditService.record(userId, AuditAction.CREATE_VEHICLE, AuditEntityType.VEHICLE,
                String.valueOf(vehicle.getId()), details, registration);

        return toResponse(vehicle);
    }

    /**
     * Applies the request to an existing vehicle. Only changed fields are audited.
     * A registration change is pushed into the denormalized alert copies.
     *
     * @return empty when the vehicle does not exist
     * @throws ValidationException blank registration or registration taken by another vehicle
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public Optional<VehicleResponse> update(Long id, VehicleRequest request, String userId) {
        String registration = normalizeRegistration(request.getRegistrationNumber());

        Optional<Vehicle> locked = vehicleRepository.findByIdForUpdate(id);
        if (locked.isEmpty()) {
            log.warn("VEHICLE: Update requested for unknown vehicle #{}", id);
            return Optional.empty();
        }
        Vehicle vehicle = locked.get();

        if (!registration.equals(vehicle.getRegistrationNumber())) {
            vehicleRepository.findByRegistrationNumber(registration)
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        throw new ValidationException("registrationNumber",
                                "A vehicle with registration " + registration + " already exists");
                    });
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        String oldRegistration = vehicle.getRegistrationNumber();
        if (changed(changes, "registrationNumber", vehicle.getRegistrationNumber(), registration)) {
            vehicle.setRegistrationNumber(registration);
        }
        String make = trimToNull(request.getMake());
        if (changed(changes, "make", vehicle.getMake(), make)) {
            vehicle.setMake(make);
        }
        String model = trimToNull(request.getModel());
        if (changed(changes, "model", vehicle.getModel(), model)) {
            vehicle.setModel(model);
        }
        String vehicleType = trimToNull(request.getVehicleType());
        if (changed(changes, "vehicleType", vehicle.getVehicleType(), vehicleType)) {
            vehicle.setVehicleType(vehicleType);
        }

        if (changes.isEmpty()) {
            log.info("VEHICLE: Update of #{} ({}) by '{}' changed nothing", id, oldRegistration, userId);
            return Optional.of(toResponse(vehicle));
        }

        vehicle.setUpdatedAt(LocalDateTime.now(clock));
        vehicleRepository.save(vehicle);
        log.info("VEHICLE: Updated #{} ({}) by '{}', changed: {}", id, registration, userId, changes.keySet());

        if (changes.containsKey("registrationNumber")) {
            Set<String> owners = new LinkedHashSet<>();
            owners.add(userId);
            alertRepository.findByVehicleId(id).stream()
                    .map(ComplianceAlert::getOwnerId)
                    .forEach(owners::add);
            owners.forEach(owner -> alertSynchronizer.synchronize(vehicle, owner));
        }

        auditService.record(userId, AuditAction.UPDATE_VEHICLE, AuditEntityType.VEHICLE,
                String.valueOf(id), changes, registration);
        return Optional.of(toResponse(vehicle));
    }

    /**
     * Deletes the vehicle, its document history (cascade) and every owner's alerts for it.
     * Audit entries about the vehicle are kept.
     *
     * @return false when the vehicle does not exist
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public boolean delete(Long id, String userId) {
        Optional<Vehicle> locked = vehicleRepository.findByIdForUpdate(id);
        if (locked.isEmpty()) {
            log.warn("VEHICLE: Delete requested for unknown vehicle #{}", id);
            return false;
        }
        Vehicle vehicle = locked.get();

        List<ComplianceAlert> alerts = alertRepository.findByVehicleId(id);
        alertRepository.deleteAll(alerts);
        int documentCount = vehicle.getDocuments().size();
        vehicleRepository.delete(vehicle);

        log.info("VEHICLE: Deleted #{} ({}) by '{}', {} document(s), {} alert(s) removed",
                id, vehicle.getRegistrationNumber(), userId, documentCount, alerts.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("registrationNumber", vehicle.getRegistrationNumber());
        details.put("make", vehicle.getMake());
        details.put("model", vehicle.getModel());
        details.put("vehicleType", vehicle.getVehicleType());
        details.put("documentCount", documentCount);
        details.put("removedAlerts", alerts.size());
        auditService.record(userId, AuditAction.DELETE_VEHICLE, AuditEntityType.VEHICLE,
                String.valueOf(id), details, vehicle.getRegistrationNumber());
        return true;
    }

    // ── Queries ────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public Optional<VehicleResponse> find(Long id) {
        return vehicleRepository.findById(id).map(this::toResponse);
    }

    /** All vehicles sorted by registration, each with its overall status */
    @Transactional(readOnly = true)
    public List<VehicleResponse> list() {
        return vehicleRepository.findAllWithDocuments().stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Overall status, one entry per tracked obligation and the full document history
     * (by document type, newest upload first).
     */
    @Transactional(readOnly = true)
    public Optional<VehicleDetailsResponse> details(Long id) {
        return vehicleRepository.findById(id).map(vehicle -> {
            List<ObligationStatus> statuses = aggregator.evaluate(vehicle);

            List<ObligationStatusResponse> obligations = statuses.stream()
                    .map(this::toObligationResponse)
                    .toList();
            List<DocumentResponse> documents = vehicle.getDocuments().stream()
                    .sorted(HISTORY_ORDER)
                    .map(d -> DocumentResponse.from(d, classifier.classify(d.getExpiryDate())))
                    .toList();

            return VehicleDetailsResponse.builder()
                    .vehicle(VehicleResponse.from(vehicle, aggregator.overallStatus(vehicle, statuses)))
                    .obligations(obligations)
                    .documents(documents)
                    .build();
        });
    }

    public List<String> suggestedVehicleTypes() {
        return SUGGESTED_VEHICLE_TYPES;
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private VehicleResponse toResponse(Vehicle vehicle) {
        return VehicleResponse.from(vehicle, aggregator.overallStatus(vehicle));
    }

    private ObligationStatusResponse toObligationResponse(ObligationStatus status) {
        VehicleDocument governing = status.getGoverningDocument();
        return ObligationStatusResponse.builder()
                .documentType(status.getObligation().getDocumentType())
                .customTypeName(status.getObligation().getCustomTypeName())
                .displayName(status.getObligation().getDisplayName())
                .status(status.getStatus())
                .governingDocumentId(governing != null ? governing.getId() : null)
                .policyNumber(governing != null ? governing.getPolicyNumber() : null)
                .expiryDate(governing != null ? governing.getExpiryDate() : null)
                .daysRemaining(governing != null ? classifier.daysRemaining(governing.getExpiryDate()) : null)
                .build();
    }

    /** Trimmed, upper-cased registration number */
    static String normalizeRegistration(String registrationNumber) {
        if (registrationNumber == null || registrationNumber.isBlank()) {
            throw new ValidationException("registrationNumber", "Registration number is required");
        }
        return registrationNumber.trim().toUpperCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /** Records {field: {old, new}} when the value changes */
    private static boolean changed(Map<String, Object> changes, String field, Object oldValue, Object newValue) {
        if (Objects.equals(oldValue, newValue)) {
            return false;
        }
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("old", oldValue);
        diff.put("new", newValue);
        changes.put(field, diff);
        return true;
    }
}
