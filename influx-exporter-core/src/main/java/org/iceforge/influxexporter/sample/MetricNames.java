package org.iceforge.influxexporter.sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Metric and label name sanitization plus series fingerprints.
 */
public final class MetricNames {

    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private MetricNames() {}

    /** Replaces every character outside {@code [a-zA-Z0-9_]} with {@code _}. */
    public static String sanitize(String raw) {
        return INVALID_CHARS.matcher(raw).replaceAll("_");
    }

    /**
     * Identity of a series: the name followed by every label name/value pair in label-name
     * order, rendered as a quoted list such as {@code ["cpu" "host" "a"]}.
     */
    public static String fingerprint(String name, Map<String, String> labels) {
        Map<String, String> sorted = new TreeMap<>(labels);

        List<String> parts = new ArrayList<>(sorted.size() * 2 + 1);
        parts.add(name);
        sorted.forEach((k, v) -> {
            parts.add(k);
            parts.add(v);
        });

        StringBuilder sb = new StringBuilder();
        sb.append('[');
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(' ');
            quote(parts.get(i), sb);
        }
        return sb.append(']').toString();
    }

    private static void quote(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
