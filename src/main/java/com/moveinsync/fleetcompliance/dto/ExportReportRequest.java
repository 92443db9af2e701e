package com.moveinsync.fleetcompliance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.*;

import java.util.Map;

/**
 * Records that a report was exported client-side. The export file itself is not produced here.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExportReportRequest {

    @NotBlank(message = "Report name is required")
    private String reportName;

    @NotBlank(message = "Format is required")
    @Pattern(regexp = "(?i)csv|pdf|xlsx", message = "Format must be one of CSV, PDF, XLSX")
    private String format;

    /** Filters active at export time, copied into the audit entry */
    private Map<String, Object> filters;
}
