package com.moveinsync.fleetcompliance.dto;

import lombok.Value;

/**
 * Vehicle counts per overall verdict. compliant + expiringSoon + overdue + missingInfo == total.
 */
@Value
public class ComplianceBreakdown {

    long compliant;
    long expiringSoon;
    long overdue;
    long missingInfo;
    long total;
}
