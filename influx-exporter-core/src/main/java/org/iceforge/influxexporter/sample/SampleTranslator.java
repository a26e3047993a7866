package org.iceforge.influxexporter.sample;

import org.iceforge.influxexporter.lineprotocol.FieldValue;
import org.iceforge.influxexporter.lineprotocol.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Turns a decoded point into one sample per numeric or boolean field.
 *
 * <p>A field named {@code value} maps to the bare measurement name; any other field
 * becomes {@code measurement_field}. Unsigned and string fields are skipped.
 */
public final class SampleTranslator {
    private static final Logger log = LoggerFactory.getLogger(SampleTranslator.class);

    static final String VALUE_FIELD = "value";

    public List<Sample> translate(Point point) {
        TreeMap<String, String> labels = new TreeMap<>();
        for (Map.Entry<String, String> tag : point.tags().entrySet()) {
            labels.put(MetricNames.sanitize(tag.getKey()), tag.getValue());
        }

        List<Sample> samples = new ArrayList<>(point.fields().size());
        for (Map.Entry<String, FieldValue> field : point.fields().entrySet()) {
            OptionalDouble value = coerce(field.getValue());
            if (value.isEmpty()) {
                continue;
            }

            String name = VALUE_FIELD.equals(field.getKey())
                    ? point.measurement()
                    : point.measurement() + "_" + field.getKey();

            Sample sample = new Sample(
                    MetricNames.fingerprint(name, labels),
                    MetricNames.sanitize(name),
                    labels,
                    value.getAsDouble(),
                    point.timestamp());
            log.debug("Translated {}", sample);
            samples.add(sample);
        }
        return samples;
    }

    static OptionalDouble coerce(FieldValue value) {
        return switch (value.kind()) {
            case FLOAT -> OptionalDouble.of(((FieldValue.FloatValue) value).value());
            case INTEGER -> OptionalDouble.of(((FieldValue.IntegerValue) value).value());
            case BOOLEAN -> OptionalDouble.of(((FieldValue.BooleanValue) value).value() ? 1.0 : 0.0);
            case UNSIGNED, STRING -> OptionalDouble.empty();
        };
    }
}
