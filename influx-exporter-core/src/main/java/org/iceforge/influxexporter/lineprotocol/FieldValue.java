package org.iceforge.influxexporter.lineprotocol;

import java.util.Objects;

/**
 * A decoded field value. Consumers switch over {@link #kind()}.
 */
public sealed interface FieldValue
        permits FieldValue.FloatValue, FieldValue.IntegerValue, FieldValue.UnsignedValue,
        FieldValue.BooleanValue, FieldValue.StringValue {

    enum Kind { FLOAT, INTEGER, UNSIGNED, BOOLEAN, STRING }

    Kind kind();

    record FloatValue(double value) implements FieldValue {
        @Override
        public Kind kind() { return Kind.FLOAT; }
    }

    record IntegerValue(long value) implements FieldValue {
        @Override
        public Kind kind() { return Kind.INTEGER; }
    }

    /** Unsigned 64-bit integer; read {@link #value()} with {@link Long#toUnsignedString(long)}. */
    record UnsignedValue(long value) implements FieldValue {
        @Override
        public Kind kind() { return Kind.UNSIGNED; }
    }

    record BooleanValue(boolean value) implements FieldValue {
        @Override
        public Kind kind() { return Kind.BOOLEAN; }
    }

    record StringValue(String value) implements FieldValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() { return Kind.STRING; }
    }
}
