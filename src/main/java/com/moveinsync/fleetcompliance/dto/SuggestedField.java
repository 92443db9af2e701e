package com.moveinsync.fleetcompliance.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.*;

/**
 * A value proposed by the AI extraction service together with its confidence.
 * Unverified: stored for comparison only, never applied to a document.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SuggestedField {

    private String value;

    @DecimalMin(value = "0.0", message = "confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "confidence must be between 0 and 1")
    private Double confidence;
}
