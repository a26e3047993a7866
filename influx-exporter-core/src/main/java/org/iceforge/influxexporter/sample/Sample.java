package org.iceforge.influxexporter.sample;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Latest known value of one series.
 *
 * @param fingerprint store key derived from the metric name and the sorted labels
 * @param name        sanitized metric name
 * @param labels      sanitized label names to verbatim values, sorted by name
 * @param value       sample value
 * @param timestamp   event time carried by the point, not the arrival time
 */
public record Sample(
        String fingerprint,
        String name,
        SortedMap<String, String> labels,
        double value,
        Instant timestamp
) {
    public Sample {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
        labels = labels == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(labels));
    }

    /** True when the event time lies strictly before {@code cutoff}. */
    public boolean isOlderThan(Instant cutoff) {
        return timestamp.isBefore(cutoff);
    }
}
