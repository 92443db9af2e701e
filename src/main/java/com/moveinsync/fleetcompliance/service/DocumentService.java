package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.dto.DocumentResponse;
import com.moveinsync.fleetcompliance.dto.DocumentUploadRequest;
import com.moveinsync.fleetcompliance.dto.SuggestedField;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.ComplianceAlert;
import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.Vehicle;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import com.moveinsync.fleetcompliance.exception.ValidationException;
import com.moveinsync.fleetcompliance.repository.AlertRepository;
import com.moveinsync.fleetcompliance.repository.VehicleDocumentRepository;
import com.moveinsync.fleetcompliance.repository.VehicleRepository;
import com.moveinsync.fleetcompliance.util.ComplianceDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DocumentService: document upload and governing-document lookup.
 *
 * Upload flow (one transaction, vehicle row locked):
 *  1. Validate the request (type, custom name, dates, AI confidences); nothing is written on failure
 *  2. Lock the vehicle (findByIdForUpdate) so concurrent uploads for it are serialized
 *  3. Append a new VehicleDocument; older documents are never modified
 *  4. Synchronize the alerts of the uploader and of every owner holding alerts for the vehicle
 *  5. Audit UPLOAD_DOCUMENT with the confirmed values next to the AI suggestions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentService {

    private final VehicleRepository vehicleRepository;
    private final VehicleDocumentRepository documentRepository;
    private final AlertRepository alertRepository;
    private final LatestDocumentSelector documentSelector;
    private final ComplianceClassifier classifier;
    private final AlertSynchronizer alertSynchronizer;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * @return the stored document, or empty when the vehicle does not exist
     * @throws ValidationException on invalid input, before anything is written
     */
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${fleet.store.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${fleet.store.retry.delay-ms:200}",
                    multiplierExpression = "${fleet.store.retry.multiplier:2.0}"))
    public Optional<DocumentResponse> upload(Long vehicleId, DocumentUploadRequest request, String userId) {
        DocumentType type = parseDocumentType(request.getDocumentType());
        String customTypeName = null;
        if (type == DocumentType.OTHER) {
            customTypeName = trimToNull(request.getCustomTypeName());
            if (customTypeName == null) {
                throw new ValidationException("customTypeName", "Custom type name is required for OTHER documents");
            }
        }
        LocalDate startDate = parseDate("startDate", request.getStartDate());
        LocalDate expiryDate = parseDate("expiryDate", request.getExpiryDate());
        if (startDate != null && expiryDate != null && startDate.isAfter(expiryDate)) {
            throw new ValidationException("expiryDate",
                    "Expiry date " + expiryDate + " must not be before start date " + startDate);
        }
        checkConfidence("aiPolicyNumber", request.getAiPolicyNumber());
        checkConfidence("aiStartDate", request.getAiStartDate());
        checkConfidence("aiExpiryDate", request.getAiExpiryDate());

        Optional<Vehicle> locked = vehicleRepository.findByIdForUpdate(vehicleId);
        if (locked.isEmpty()) {
            log.warn("DOCUMENT: Upload requested for unknown vehicle #{}", vehicleId);
            return Optional.empty();
        }
        Vehicle vehicle = locked.get();

        LocalDateTime now = LocalDateTime.now(clock);
        VehicleDocument document = VehicleDocument.builder()
                .documentType(type)
                .customTypeName(customTypeName)
                .policyNumber(trimToNull(request.getPolicyNumber()))
                .startDate(startDate)
                .expiryDate(expiryDate)
                .documentName(trimToNull(request.getDocumentName()))
                .documentUrl(trimToNull(request.getDocumentUrl()))
                .uploadedAt(now)
                .aiExtractedPolicyNumber(suggestedValue(request.getAiPolicyNumber()))
                .aiPolicyNumberConfidence(suggestedConfidence(request.getAiPolicyNumber()))
                .aiExtractedStartDate(suggestedDate("aiStartDate", request.getAiStartDate()))
                .aiStartDateConfidence(suggestedConfidence(request.getAiStartDate()))
                .aiExtractedExpiryDate(suggestedDate("aiExpiryDate", request.getAiExpiryDate()))
                .aiExpiryDateConfidence(suggestedConfidence(request.getAiExpiryDate()))
                .build();
        vehicle.addDocument(document);
        vehicle.setUpdatedAt(now);
        documentRepository.save(document);

        DocumentStatus status = classifier.classify(expiryDate);
        log.info("DOCUMENT: {} uploaded for {} by '{}', expiry: {}, status: {}",
                document.getDisplayName(), vehicle.getRegistrationNumber(), userId,
                expiryDate != null ? expiryDate : "none", status);

        Set<String> owners = new LinkedHashSet<>();
        owners.add(userId);
        alertRepository.findByVehicleId(vehicleId).stream()
                .map(ComplianceAlert::getOwnerId)
                .forEach(owners::add);
        owners.forEach(owner -> alertSynchronizer.synchronize(vehicle, owner));

        auditService.record(userId, AuditAction.UPLOAD_DOCUMENT, AuditEntityType.DOCUMENT,
                String.valueOf(document.getId()), uploadDetails(document, status), vehicle.getRegistrationNumber());

        return Optional.of(DocumentResponse.from(document, status));
    }

    /**
     * Governing document of one obligation: the one expiring last, ties broken by latest upload.
     *
     * @return empty when the vehicle is unknown or has no document of that kind with an expiry date
     */
    @Transactional(readOnly = true)
    public Optional<DocumentResponse> latest(Long vehicleId, String documentType, String customTypeName) {
        DocumentType type = parseDocumentType(documentType);
        return vehicleRepository.findById(vehicleId)
                .flatMap(vehicle -> documentSelector.latestFor(vehicle, type, trimToNull(customTypeName)))
                .map(d -> DocumentResponse.from(d, classifier.classify(d.getExpiryDate())));
    }

    // ── Validation ─────────────────────────────────────────────────────────────

    static DocumentType parseDocumentType(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("documentType", "Document type is required");
        }
        try {
            return DocumentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("documentType",
                    "Unknown document type '" + value + "'. Allowed: " + Arrays.toString(DocumentType.values()));
        }
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ComplianceDates.parseIsoDate(value)
                .orElseThrow(() -> new ValidationException(field,
                        "'" + value + "' is not a valid date, expected YYYY-MM-DD"));
    }

    private static void checkConfidence(String field, SuggestedField suggestion) {
        if (suggestion == null || suggestion.getConfidence() == null) {
            return;
        }
        double confidence = suggestion.getConfidence();
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new ValidationException(field + ".confidence", "Confidence must be between 0 and 1");
        }
    }

    // ── AI suggestions ─────────────────────────────────────────────────────────

    private static String suggestedValue(SuggestedField suggestion) {
        return suggestion != null ? trimToNull(suggestion.getValue()) : null;
    }

    private static Double suggestedConfidence(SuggestedField suggestion) {
        return suggestion != null && suggestion.getValue() != null ? suggestion.getConfidence() : null;
    }

    /** Unreadable AI dates are dropped; the suggestion is advisory only */
    private static LocalDate suggestedDate(String field, SuggestedField suggestion) {
        String raw = suggestedValue(suggestion);
        if (raw == null) {
            return null;
        }
        Optional<LocalDate> parsed = ComplianceDates.parseIsoDate(raw);
        if (parsed.isEmpty()) {
            log.warn("DOCUMENT: Ignoring unparseable {} suggestion '{}'", field, raw);
        }
        return parsed.orElse(null);
    }

    private static Map<String, Object> uploadDetails(VehicleDocument document, DocumentStatus status) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("vehicleId", document.getVehicle().getId());
        details.put("documentType", document.getDocumentType().name());
        details.put("customTypeName", document.getCustomTypeName());
        details.put("policyNumber", document.getPolicyNumber());
        details.put("startDate", ComplianceDates.format(document.getStartDate()));
        details.put("expiryDate", ComplianceDates.format(document.getExpiryDate()));
        details.put("documentName", document.getDocumentName());
        details.put("status", status.name());

        Map<String, Object> ai = new LinkedHashMap<>();
        putSuggestion(ai, "policyNumber", document.getAiExtractedPolicyNumber(),
                document.getAiPolicyNumberConfidence(), document.getPolicyNumber());
        putSuggestion(ai, "startDate", ComplianceDates.format(document.getAiExtractedStartDate()),
                document.getAiStartDateConfidence(), ComplianceDates.format(document.getStartDate()));
        putSuggestion(ai, "expiryDate", ComplianceDates.format(document.getAiExtractedExpiryDate()),
                document.getAiExpiryDateConfidence(), ComplianceDates.format(document.getExpiryDate()));
        if (!ai.isEmpty()) {
            details.put("aiSuggestions", ai);
        }
        return details;
    }

    private static void putSuggestion(Map<String, Object> target, String field,
                                      String suggested, Double confidence, String confirmed) {
        if (suggested == null) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("value", suggested);
        entry.put("confidence", confidence);
        entry.put("overridden", !Objects.equals(suggested, confirmed));
        target.put(field, entry);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
