package org.iceforge.influxexporter.lineprotocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded line: measurement, tag set, field set and event time.
 */
public record Point(
        String measurement,
        Map<String, String> tags,
        Map<String, FieldValue> fields,
        Instant timestamp
) {
    public Point {
        Objects.requireNonNull(measurement, "measurement");
        Objects.requireNonNull(timestamp, "timestamp");
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
