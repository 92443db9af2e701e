package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.DocumentType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Dashboard snapshot of the whole fleet.
 *
 * Vehicle figures come from each vehicle's overall verdict; document figures are
 * a flat tally over the governing document of every tracked obligation.
 * Immutable once built.
 */
@Value
@Builder
public class ComplianceSummary {

    long totalVehicles;
    long compliantVehicles;
    long expiringSoonDocuments;
    long overdueDocuments;

    /** Every DocumentType is present, zero when none */
    Map<DocumentType, Long> perKindExpiring;
    Map<DocumentType, Long> perKindOverdue;

    ComplianceBreakdown complianceBreakdown;
}
