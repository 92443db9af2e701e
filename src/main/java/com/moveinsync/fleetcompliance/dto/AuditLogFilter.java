package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import lombok.*;

import java.time.LocalDate;

/**
 * Optional criteria for the audit listing. Null fields do not filter.
 * The date range is inclusive on both ends, by calendar day.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class AuditLogFilter {

    private String userId;
    private AuditEntityType entityType;
    private AuditAction action;
    private LocalDate from;
    private LocalDate to;
}
