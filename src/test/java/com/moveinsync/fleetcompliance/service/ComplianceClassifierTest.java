package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ComplianceClassifier: boundaries of the 30-day warning window.
 *
 * Today is fixed at 2026-10-19.
 */
class ComplianceClassifierTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private ComplianceClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ComplianceClassifier(Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC));
        // Inject @Value field that Spring cannot set in unit tests
        ReflectionTestUtils.setField(classifier, "warningDays", 30);
    }

    // ── Boundaries ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("No expiry date → MISSING")
    void noDate_missing() {
        assertThat(classifier.classify((LocalDate) null)).isEqualTo(DocumentStatus.MISSING);
    }

    @Test
    @DisplayName("Expiring today is EXPIRING_SOON, not OVERDUE")
    void expiringToday_isExpiringSoon() {
        assertThat(classifier.classify(TODAY)).isEqualTo(DocumentStatus.EXPIRING_SOON);
    }

    @Test
    @DisplayName("Expired yesterday → OVERDUE")
    void expiredYesterday_overdue() {
        assertThat(classifier.classify(TODAY.minusDays(1))).isEqualTo(DocumentStatus.OVERDUE);
    }

    @Test
    @DisplayName("29 days left → EXPIRING_SOON, 30 days left → COMPLIANT (exclusive bound)")
    void warningWindow_exclusiveUpperBound() {
        assertThat(classifier.classify(TODAY.plusDays(29))).isEqualTo(DocumentStatus.EXPIRING_SOON);
        assertThat(classifier.classify(TODAY.plusDays(30))).isEqualTo(DocumentStatus.COMPLIANT);
        assertThat(classifier.classify(TODAY.plusDays(365))).isEqualTo(DocumentStatus.COMPLIANT);
    }

    @Test
    @DisplayName("Warning window follows compliance.expiry-warning-days")
    void warningWindow_configurable() {
        ReflectionTestUtils.setField(classifier, "warningDays", 7);

        assertThat(classifier.classify(TODAY.plusDays(6))).isEqualTo(DocumentStatus.EXPIRING_SOON);
        assertThat(classifier.classify(TODAY.plusDays(7))).isEqualTo(DocumentStatus.COMPLIANT);
    }

    // ── Raw input ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("String variant: malformed or blank dates classify as MISSING, never throw")
    void rawString_malformedIsMissing() {
        assertThat(classifier.classify("2026-13-45")).isEqualTo(DocumentStatus.MISSING);
        assertThat(classifier.classify("")).isEqualTo(DocumentStatus.MISSING);
        assertThat(classifier.classify((String) null)).isEqualTo(DocumentStatus.MISSING);
        assertThat(classifier.classify("2026-10-18")).isEqualTo(DocumentStatus.OVERDUE);
    }

    @Test
    @DisplayName("daysRemaining is signed and null without a date")
    void daysRemaining() {
        assertThat(classifier.daysRemaining(TODAY.plusDays(12))).isEqualTo(12L);
        assertThat(classifier.daysRemaining(TODAY.minusDays(5))).isEqualTo(-5L);
        assertThat(classifier.daysRemaining(null)).isNull();
    }

    @Test
    @DisplayName("Today is taken in the clock's zone")
    void today_usesClockZone() {
        // 23:30 UTC on the 19th is already the 20th in Kolkata
        ComplianceClassifier kolkata = new ComplianceClassifier(
                Clock.fixed(Instant.parse("2026-10-19T23:30:00Z"), ZoneId.of("Asia/Kolkata")));
        ReflectionTestUtils.setField(kolkata, "warningDays", 30);

        assertThat(kolkata.today()).isEqualTo(LocalDate.of(2026, 10, 20));
        assertThat(kolkata.classify(LocalDate.of(2026, 10, 19))).isEqualTo(DocumentStatus.OVERDUE);
    }
}
