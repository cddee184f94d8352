package com.jdbg.output;

import com.jdbg.expr.Atom;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prints runtime values the way they would be written as literals: {@code nil}, {@code :ok},
 * {@code "text"}, {@code [1, 2]}, {@code %{"a" => 1}}. Collections that do not fit the line
 * width are broken one element per line.
 */
public class ValueInspector {
    private final Palette palette;
    private final int width;

    public ValueInspector(Palette palette, int width) {
        this.palette = palette;
        this.width = width;
    }

    public String inspect(Object value) {
        StringBuilder sb = new StringBuilder();
        formatPretty(value, 0, sb);
        return sb.toString();
    }

    void formatPretty(Object value, int indent, StringBuilder sb) {
        if (!isCollection(value) || fits(value, indent)) {
            formatFlat(value, palette, sb);
            return;
        }
        String indentStr = " ".repeat(indent);

        if (value instanceof List<?> list) {
            sb.append("[\n");
            boolean first = true;
            for (Object element : list) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;
                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }
            sb.append("\n").append(indentStr).append("]");
            return;
        }

        Map<?, ?> map = (Map<?, ?>) value;
        sb.append("%{\n");
        boolean first = true;
        for (Map.Entry<?, ?> entry : sortedEntries(map)) {
            if (!first) {
                sb.append(",\n");
            }
            first = false;
            sb.append(indentStr).append("  ");
            formatKey(entry.getKey(), palette, sb);
            formatPretty(entry.getValue(), indent + 2, sb);
        }
        sb.append("\n").append(indentStr).append("}");
    }

    private boolean fits(Object value, int indent) {
        StringBuilder flat = new StringBuilder();
        formatFlat(value, Palette.PLAIN, flat);
        return indent + flat.length() <= width;
    }

    static void formatFlat(Object value, Palette palette, StringBuilder sb) {
        if (value == null) {
            sb.append(palette.bool("nil"));
        } else if (value instanceof Boolean b) {
            sb.append(palette.bool(b.toString()));
        } else if (value instanceof Long || value instanceof Integer || value instanceof BigInteger) {
            sb.append(palette.number(value.toString()));
        } else if (value instanceof Double d) {
            sb.append(palette.number(formatDouble(d)));
        } else if (value instanceof String s) {
            sb.append(palette.string("\"" + escapeString(s) + "\""));
        } else if (value instanceof Atom atom) {
            sb.append(palette.atom(":" + atom.name()));
        } else if (value instanceof List<?> list) {
            sb.append("[");
            boolean first = true;
            for (Object element : list) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                formatFlat(element, palette, sb);
            }
            sb.append("]");
        } else if (value instanceof Map<?, ?> map) {
            sb.append("%{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : sortedEntries(map)) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                formatKey(entry.getKey(), palette, sb);
                formatFlat(entry.getValue(), palette, sb);
            }
            sb.append("}");
        } else {
            sb.append(value);
        }
    }

    private static void formatKey(Object key, Palette palette, StringBuilder sb) {
        if (key instanceof Atom atom) {
            sb.append(palette.atom(atom.name() + ":")).append(" ");
        } else {
            formatFlat(key, palette, sb);
            sb.append(" => ");
        }
    }

    /** Entries ordered by their printed key, so that output does not depend on hashing. */
    private static MutableList<Map.Entry<?, ?>> sortedEntries(Map<?, ?> map) {
        MutableList<Map.Entry<?, ?>> entries = Lists.mutable.empty();
        entries.addAll(map.entrySet());
        return entries.sortThisBy(entry -> {
            StringBuilder key = new StringBuilder();
            formatFlat(entry.getKey(), Palette.PLAIN, key);
            return key.toString();
        });
    }

    private static boolean isCollection(Object value) {
        return value instanceof List<?> || value instanceof Map<?, ?>;
    }

    private static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return Double.toString(value).replace('E', 'e');
    }

    /** Escapes quotes, backslashes and every control character so none reaches the terminal raw. */
    static String escapeString(String s) {
        if (s.chars().noneMatch(c -> c == '\\' || c == '"' || Character.isISOControl(c))) {
            return s;
        }
        StringBuilder escaped = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                case '\033' -> escaped.append("\\e");
                case '\0' -> escaped.append("\\0");
                case '\b' -> escaped.append("\\b");
                case '\f' -> escaped.append("\\f");
                case '\007' -> escaped.append("\\a");
                case '\013' -> escaped.append("\\v");
                default -> {
                    if (Character.isISOControl(c)) {
                        escaped.append(String.format(Locale.ROOT, "\\u%04X", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
