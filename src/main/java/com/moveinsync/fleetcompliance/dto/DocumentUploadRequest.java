package com.moveinsync.fleetcompliance.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * DTO for uploading a new document instance for a vehicle.
 *
 * Dates are YYYY-MM-DD strings and are parsed by DocumentService, so a malformed
 * value is reported as a field validation error instead of a JSON parse failure.
 *
 * The ai* fields carry what the extraction service suggested; the authoritative
 * values are the ones the user confirmed (policyNumber, startDate, expiryDate).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentUploadRequest {

    /** DocumentType name, e.g. "INSURANCE" (case-insensitive) */
    @NotBlank(message = "Document type is required")
    private String documentType;

    /** Required when documentType is OTHER */
    private String customTypeName;

    private String policyNumber;

    private String startDate;

    /** Optional: a document without expiry date is kept as history but never governs */
    private String expiryDate;

    private String documentName;

    private String documentUrl;

    @Valid
    private SuggestedField aiPolicyNumber;

    @Valid
    private SuggestedField aiStartDate;

    @Valid
    private SuggestedField aiExpiryDate;
}
