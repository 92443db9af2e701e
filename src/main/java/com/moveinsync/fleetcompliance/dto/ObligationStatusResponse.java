package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import lombok.*;

import java.time.LocalDate;

/**
 * Current state of one tracked obligation (document type + custom name).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObligationStatusResponse {

    private DocumentType documentType;
    private String customTypeName;
    private String displayName;
    private DocumentStatus status;

    /** Null when no document of this obligation has an expiry date */
    private Long governingDocumentId;
    private String policyNumber;
    private LocalDate expiryDate;

    /** Negative when overdue */
    private Long daysRemaining;
}
