package com.moveinsync.fleetcompliance.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Utility class for calendar-date arithmetic used by the compliance rules.
 *
 * All dates are plain calendar dates (YYYY-MM-DD, no time of day, no zone).
 * "Today" is always passed in by the caller, which obtains it from the injected
 * Clock, so these functions stay pure.
 */
public final class ComplianceDates {

    /** Wire format for every date exchanged with the store and the REST API */
    public static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    /** Human-readable format used inside alert messages, e.g. "Nov 02, 2026" */
    public static final DateTimeFormatter DISPLAY_DATE =
            DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private ComplianceDates() {
    }

    /**
     * Parses a YYYY-MM-DD string.
     *
     * @param value raw value, may be null or blank
     * @return the date, or empty when the value is absent or not a valid calendar date
     */
    public static Optional<LocalDate> parseIsoDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim(), ISO_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Whole-day granularity: a date equal to today is not "before today".
     * Equivalent to "end of day of {@code date} is strictly before start of {@code today}".
     */
    public static boolean isBeforeToday(LocalDate date, LocalDate today) {
        return date.isBefore(today);
    }

    /**
     * Signed whole-day count from today to {@code date}.
     * 0 for today, positive for future dates, negative for past dates.
     */
    public static long daysUntil(LocalDate date, LocalDate today) {
        return ChronoUnit.DAYS.between(today, date);
    }

    /** Whole days elapsed since {@code date}; negative when {@code date} is in the future */
    public static long daysSince(LocalDate date, LocalDate today) {
        return ChronoUnit.DAYS.between(date, today);
    }

    public static String format(LocalDate date) {
        return date != null ? date.format(ISO_DATE) : null;
    }

    public static String formatForDisplay(LocalDate date) {
        return date.format(DISPLAY_DATE);
    }
}
