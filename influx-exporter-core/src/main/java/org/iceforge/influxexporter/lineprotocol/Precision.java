package org.iceforge.influxexporter.lineprotocol;

import java.time.Instant;
import java.util.Locale;

/**
 * Unit of the timestamps in a line-protocol payload.
 */
public enum Precision {
    NANOSECONDS(1L),
    MICROSECONDS(1_000L),
    MILLISECONDS(1_000_000L),
    SECONDS(1_000_000_000L),
    MINUTES(60L * 1_000_000_000L),
    HOURS(3_600L * 1_000_000_000L);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final long nanosPerUnit;

    Precision(long nanosPerUnit) {
        this.nanosPerUnit = nanosPerUnit;
    }

    public long nanosPerUnit() {
        return nanosPerUnit;
    }

    /**
     * Maps the {@code precision} request parameter to a precision. Missing or unknown
     * values fall back to nanoseconds, which is what write clients assume by default.
     */
    public static Precision fromQueryValue(String value) {
        if (value == null || value.isBlank()) {
            return NANOSECONDS;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "u", "us", "µ" -> MICROSECONDS;
            case "ms" -> MILLISECONDS;
            case "s" -> SECONDS;
            case "m" -> MINUTES;
            case "h" -> HOURS;
            default -> NANOSECONDS;
        };
    }

    /**
     * Converts a raw timestamp in this unit to an instant.
     *
     * @throws ArithmeticException if the value does not fit in 64-bit nanoseconds
     */
    Instant toInstant(long timestamp) {
        long nanos = Math.multiplyExact(timestamp, nanosPerUnit);
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    /** Drops everything below this unit. */
    Instant truncate(Instant instant) {
        long nanos = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
        return toInstant(Math.floorDiv(nanos, nanosPerUnit));
    }
}
