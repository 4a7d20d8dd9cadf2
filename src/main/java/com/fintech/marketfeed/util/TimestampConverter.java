package com.fintech.marketfeed.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Coerces vendor timestamps into UTC instants with millisecond precision.
 * Handles epoch seconds (with or without fraction), millis, micros and nanos,
 * as numbers or numeric strings, and ISO-8601 text with or without offset.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public final class TimestampConverter {

    private static final DateTimeFormatter ISO_MILLIS =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    // Magnitude thresholds for epoch values (anything above is the next finer unit)
    private static final BigDecimal SECONDS_LIMIT = new BigDecimal("1e12");
    private static final BigDecimal MILLIS_LIMIT = new BigDecimal("1e15");
    private static final BigDecimal MICROS_LIMIT = new BigDecimal("1e18");
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private TimestampConverter() {
    }

    /**
     * Converts an epoch value of unknown unit.
     * Values below 1e12 are seconds, below 1e15 millis, below 1e18 micros, else nanos.
     *
     * @throws IllegalArgumentException if the value is negative
     */
    public static Instant fromEpoch(BigDecimal value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative epoch timestamp: " + value);
        }
        BigDecimal millis;
        if (value.compareTo(SECONDS_LIMIT) < 0) {
            millis = value.multiply(THOUSAND);
        } else if (value.compareTo(MILLIS_LIMIT) < 0) {
            millis = value;
        } else if (value.compareTo(MICROS_LIMIT) < 0) {
            millis = value.divide(THOUSAND, 0, RoundingMode.DOWN);
        } else {
            millis = value.divide(THOUSAND.multiply(THOUSAND), 0, RoundingMode.DOWN);
        }
        return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.DOWN).longValueExact());
    }

    /**
     * Parses numeric or ISO-8601 text.
     *
     * @throws IllegalArgumentException if the text is neither
     */
    public static Instant parse(String text) {
        String value = text.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Empty timestamp");
        }
        if (isNumeric(value)) {
            return fromEpoch(new BigDecimal(value));
        }
        try {
            return truncate(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException withoutOffset) {
            try {
                // No offset given: vendors that omit it report UTC
                return truncate(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unparseable timestamp: " + text, e);
            }
        }
    }

    /** Drops sub-millisecond precision. */
    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    /** Formats as {@code yyyy-MM-ddTHH:mm:ss.SSSZ} in UTC. */
    public static String format(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    private static boolean isNumeric(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
