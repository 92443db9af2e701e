package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.util.ComplianceDates;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Maps a single document's expiry date to its compliance status.
 *
 * Rules (whole-day granularity, "today" from the injected Clock):
 *   - no date / unparseable date           → MISSING
 *   - expiry before today                  → OVERDUE   (expiring today is not overdue)
 *   - daysRemaining &lt; warningDays         → EXPIRING_SOON (exclusive upper bound)
 *   - otherwise                            → COMPLIANT
 *
 * Pure and total: never throws.
 */
@Component
@RequiredArgsConstructor
public class ComplianceClassifier {

    private final Clock clock;

    /** Documents expiring in fewer than this many days are EXPIRING_SOON */
    @Value("${compliance.expiry-warning-days:30}")
    private int warningDays;

    public DocumentStatus classify(LocalDate expiryDate) {
        if (expiryDate == null) {
            return DocumentStatus.MISSING;
        }
        LocalDate today = today();
        if (ComplianceDates.isBeforeToday(expiryDate, today)) {
            return DocumentStatus.OVERDUE;
        }
        if (ComplianceDates.daysUntil(expiryDate, today) < warningDays) {
            return DocumentStatus.EXPIRING_SOON;
        }
        return DocumentStatus.COMPLIANT;
    }

    /** Raw YYYY-MM-DD variant: absent or malformed input classifies as MISSING */
    public DocumentStatus classify(String expiryDate) {
        return ComplianceDates.parseIsoDate(expiryDate)
                .map(this::classify)
                .orElse(DocumentStatus.MISSING);
    }

    /**
     * Signed days from today to the expiry date (negative when overdue).
     *
     * @return null when there is no expiry date
     */
    public Long daysRemaining(LocalDate expiryDate) {
        return expiryDate != null ? ComplianceDates.daysUntil(expiryDate, today()) : null;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public int getWarningDays() {
        return warningDays;
    }
}
