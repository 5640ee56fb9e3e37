package com.fueltrack.archival.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Date helpers for retention cutoffs and archive annotations.
 *
 * <p>
 * Cutoffs use calendar months in the clock's zone, so keeping 6 months on 31 August yields
 * 29 February in a leap year rather than a fixed number of days.
 */
public final class DateTimeUtil {

    /**
     * Private constructor to prevent instantiation.
     */
    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // e.g. "Mon Feb 03 2025"
    private static final DateTimeFormatter REASON_DATE = DateTimeFormatter.ofPattern("EEE MMM dd yyyy",
            Locale.ENGLISH);

    /**
     * Returns the instant {@code months} calendar months before now.
     *
     * @param clock  source of "now" and of the zone
     * @param months number of months to go back, must be positive
     * @throws IllegalArgumentException if {@code months} is not positive
     */
    public static Instant monthsBefore(Clock clock, int months) {
        if (months < 1) {
            throw new IllegalArgumentException("Months to keep must be at least 1, got " + months);
        }
        return ZonedDateTime.now(clock).minusMonths(months).toInstant();
    }

    /**
     * Formats the cutoff the way archived records describe why they were moved.
     */
    public static String describeCutoff(Instant cutoff, ZoneId zone) {
        if (cutoff == null) {
            return null;
        }
        return cutoff.atZone(zone).format(REASON_DATE);
    }

    public static String archivedReason(Instant cutoff, ZoneId zone) {
        return "Automated archival - data older than " + describeCutoff(cutoff, zone);
    }
}
