package com.moveinsync.fleetcompliance.dto;

import lombok.*;

import java.util.List;

/**
 * Vehicle detail view: overall verdict, per-obligation status and full document history.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleDetailsResponse {

    private VehicleResponse vehicle;
    private List<ObligationStatusResponse> obligations;

    /** Sorted by document type, newest upload first within a type */
    private List<DocumentResponse> documents;
}
