package org.corpusgate.obs;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Dependency-free JSON writer for log events and report artifacts.
 *
 * <p>Maps are written in iteration order, so callers control key order with {@code LinkedHashMap}.
 */
public final class JsonEncoder {
    private static final String INDENT = "  ";

    private JsonEncoder() {
    }

    public static String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value, false, 0);
        return sb.toString();
    }

    /**
     * Two-space indented rendering, used for documents meant to be read by people.
     */
    public static String encodePretty(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value, true, 0);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value, boolean pretty, int depth) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String s) {
            appendString(sb, s);
            return;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                sb.append("null");
                return;
            }
            sb.append(value);
            return;
        }
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Map<?, ?> map) {
            appendObject(sb, map, pretty, depth);
            return;
        }
        if (value instanceof Collection<?> collection) {
            appendArray(sb, collection, pretty, depth);
            return;
        }
        appendString(sb, String.valueOf(value));
    }

    private static void appendObject(StringBuilder sb, Map<?, ?> map, boolean pretty, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, pretty, depth + 1);
            appendString(sb, String.valueOf(entry.getKey()));
            sb.append(pretty ? ": " : ":");
            appendValue(sb, entry.getValue(), pretty, depth + 1);
        }
        newline(sb, pretty, depth);
        sb.append('}');
    }

    private static void appendArray(StringBuilder sb, Collection<?> values, boolean pretty, int depth) {
        if (values.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (Object value : values) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, pretty, depth + 1);
            appendValue(sb, value, pretty, depth + 1);
        }
        newline(sb, pretty, depth);
        sb.append(']');
    }

    private static void newline(StringBuilder sb, boolean pretty, int depth) {
        if (!pretty) {
            return;
        }
        sb.append('\n');
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
