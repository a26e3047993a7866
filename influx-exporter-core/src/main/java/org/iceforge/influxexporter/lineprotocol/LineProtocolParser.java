package org.iceforge.influxexporter.lineprotocol;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decoder for the InfluxDB line protocol.
 *
 * <p>Grammar, one point per line:
 * <pre>
 *   measurement[,tagKey=tagValue...] fieldKey=fieldValue[,fieldKey=fieldValue...] [timestamp]
 * </pre>
 * <ul>
 *   <li>measurement: {@code \,} and {@code \ } escapes</li>
 *   <li>tag keys, tag values, field keys: {@code \,}, {@code \=} and {@code \ } escapes</li>
 *   <li>field values: {@code "string"}, booleans, {@code 12i}, {@code 12u}, or a float</li>
 *   <li>timestamp: integer in the requested {@link Precision}; the default time is used when absent</li>
 * </ul>
 *
 * <p>The whole payload is rejected if any line is malformed. The exception message lists every bad line.
 */
public final class LineProtocolParser {

    // Possessive digit runs: rejecting a long malformed number stays linear.
    private static final Pattern FLOAT = Pattern.compile("[+-]?(?:\\d++(?:\\.\\d*+)?|\\.\\d++)(?:[eE][+-]?\\d++)?");
    private static final Pattern SIGNED = Pattern.compile("[+-]?\\d+");
    private static final Pattern UNSIGNED = Pattern.compile("\\d+");

    public List<Point> parse(byte[] payload, Instant defaultTime, Precision precision) throws LineProtocolException {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(defaultTime, "defaultTime");
        Objects.requireNonNull(precision, "precision");

        String text = new String(payload, StandardCharsets.UTF_8);
        Instant fallbackTime = precision.truncate(defaultTime);

        List<Point> points = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String raw : splitLines(text)) {
            String line = raw.strip();
            if (line.isEmpty() || line.charAt(0) == '#') {
                continue;
            }
            try {
                points.add(parseLine(line, fallbackTime, precision));
            } catch (LineProtocolException e) {
                failures.add("unable to parse '" + line + "': " + e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            throw new LineProtocolException(String.join("\n", failures));
        }
        return points;
    }

    /**
     * Splits on newlines, except newlines inside a quoted field value. Quotes only count
     * after the first unescaped space of a line, because measurement and tag text may
     * contain literal quote characters.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        boolean seenKey = false;
        boolean inFields = false;
        boolean comment = false;
        boolean quoted = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' && !quoted) {
                lines.add(text.substring(start, i));
                start = i + 1;
                seenKey = false;
                inFields = false;
                comment = false;
                continue;
            }
            if (comment) {
                continue;
            }
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) != '\n') {
                seenKey = true;
                i++;
                continue;
            }
            if (!seenKey) {
                if (Character.isWhitespace(c)) {
                    continue;
                }
                seenKey = true;
                comment = c == '#';
            } else if (!inFields) {
                inFields = c == ' ';
            } else if (c == '"') {
                quoted = !quoted;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private Point parseLine(String line, Instant fallbackTime, Precision precision) throws LineProtocolException {
        int keyEnd = indexOfUnescaped(line, ' ', 0);
        if (keyEnd < 0) {
            throw new LineProtocolException("missing fields");
        }

        List<String> keyParts = splitUnescaped(line.substring(0, keyEnd), ',');
        String measurement = unescapeMeasurement(keyParts.get(0));
        if (measurement.isEmpty()) {
            throw new LineProtocolException("missing measurement");
        }

        Map<String, String> tags = new LinkedHashMap<>();
        for (int i = 1; i < keyParts.size(); i++) {
            String part = keyParts.get(i);
            int eq = indexOfUnescaped(part, '=', 0);
            if (part.isEmpty() || eq == 0) {
                throw new LineProtocolException("missing tag key");
            }
            if (eq < 0 || eq == part.length() - 1) {
                throw new LineProtocolException("missing tag value");
            }
            tags.put(unescapeKey(part.substring(0, eq)), unescapeKey(part.substring(eq + 1)));
        }

        int fieldStart = keyEnd;
        while (fieldStart < line.length() && line.charAt(fieldStart) == ' ') {
            fieldStart++;
        }
        int fieldEnd = indexOfUnquotedSpace(line, fieldStart);
        if (fieldEnd == fieldStart) {
            throw new LineProtocolException("missing fields");
        }
        Map<String, FieldValue> fields = parseFields(line.substring(fieldStart, fieldEnd));

        String timestampText = line.substring(fieldEnd).strip();
        if (timestampText.isEmpty()) {
            return new Point(measurement, tags, fields, fallbackTime);
        }
        long raw;
        try {
            raw = Long.parseLong(timestampText);
        } catch (NumberFormatException e) {
            throw new LineProtocolException("bad timestamp");
        }
        try {
            return new Point(measurement, tags, fields, precision.toInstant(raw));
        } catch (ArithmeticException e) {
            throw new LineProtocolException("timestamp out of range");
        }
    }

    private Map<String, FieldValue> parseFields(String section) throws LineProtocolException {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (String part : splitOutsideQuotes(section)) {
            int eq = indexOfUnescaped(part, '=', 0);
            if (part.isEmpty() || eq == 0) {
                throw new LineProtocolException("missing field key");
            }
            if (eq < 0 || eq == part.length() - 1) {
                throw new LineProtocolException("missing field value");
            }
            fields.put(unescapeKey(part.substring(0, eq)), parseFieldValue(part.substring(eq + 1)));
        }
        return fields;
    }

    static FieldValue parseFieldValue(String text) throws LineProtocolException {
        if (text.charAt(0) == '"') {
            int i = 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    break;
                }
                i++;
            }
            if (i != text.length() - 1) {
                throw new LineProtocolException("unbalanced quotes");
            }
            return new FieldValue.StringValue(unescapeString(text.substring(1, i)));
        }

        switch (text) {
            case "t", "T", "true", "True", "TRUE":
                return new FieldValue.BooleanValue(true);
            case "f", "F", "false", "False", "FALSE":
                return new FieldValue.BooleanValue(false);
            default:
                break;
        }

        char last = text.charAt(text.length() - 1);
        String digits = text.substring(0, text.length() - 1);
        if (last == 'i') {
            if (!SIGNED.matcher(digits).matches()) {
                throw new LineProtocolException("invalid integer");
            }
            try {
                return new FieldValue.IntegerValue(Long.parseLong(digits));
            } catch (NumberFormatException e) {
                throw new LineProtocolException("integer out of range");
            }
        }
        if (last == 'u') {
            if (!UNSIGNED.matcher(digits).matches()) {
                throw new LineProtocolException("invalid unsigned integer");
            }
            try {
                return new FieldValue.UnsignedValue(Long.parseUnsignedLong(digits));
            } catch (NumberFormatException e) {
                throw new LineProtocolException("unsigned integer out of range");
            }
        }

        if (!FLOAT.matcher(text).matches()) {
            throw new LineProtocolException("invalid number");
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new LineProtocolException("float out of range");
        }
        return new FieldValue.FloatValue(value);
    }

    private static int indexOfUnescaped(String s, char target, int from) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfUnquotedSpace(String s, int from) {
        boolean quoted = false;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ' ' && !quoted) {
                return i;
            }
        }
        return s.length();
    }

    private static List<String> splitUnescaped(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == separator) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    private static List<String> splitOutsideQuotes(String s) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    private static String unescapeMeasurement(String s) {
        return unescape(s, ", ");
    }

    private static String unescapeKey(String s) {
        return unescape(s, ",= ");
    }

    private static String unescape(String s, String escapable) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                if (escapable.indexOf(next) >= 0) {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static String unescapeString(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                if (next == '"' || next == '\\') {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
