package com.enterprise.rds.sql.param;

import com.enterprise.rds.sql.SqlConfigurationException;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts Java values to MySQL literals and names to MySQL identifiers for inline use.
 * Values passed through this class appear directly in SQL text (not as bind parameters),
 * so every identifier and every value composed by this project goes through
 * {@link #escapeId} or {@link #escape}.
 *
 * <p>Value rendering by {@link ValueKind}:
 * <ul>
 *   <li>{@code NULL} → {@code NULL}; NaN and infinite numbers also render {@code NULL}</li>
 *   <li>{@code BOOLEAN} → {@code true} / {@code false}</li>
 *   <li>{@code DATE} → {@code 'yyyy-MM-dd HH:mm:ss.SSS'} in the requested time zone</li>
 *   <li>{@code BINARY} → {@code X'0a1b'}</li>
 *   <li>{@code STRING} → single-quoted, backslash escapes for control characters and quotes</li>
 *   <li>{@code LIST} → {@code 1, 2, 3}; nested lists become tuples {@code (1, 2), (3, 4)}</li>
 *   <li>{@code RENDERABLE} → {@link SqlRenderable#toSqlString()} verbatim</li>
 *   <li>{@code MAP} → {@code `k1` = v1, `k2` = v2}</li>
 * </ul>
 */
public final class SqlEscaper {

    /** Time zone name meaning the JVM default zone. */
    public static final String LOCAL_TIME_ZONE = "local";

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private SqlEscaper() {}

    // ==================== Identifiers ====================

    public static String escapeId(Object name) {
        return escapeId(name, false);
    }

    /**
     * Quotes a name with backticks, doubling embedded backticks. Unless
     * {@code forbidQualified} is set, dots separate qualified parts
     * ({@code db.posts} → {@code `db`.`posts`}); otherwise the dot stays inside
     * one identifier. A list of names is escaped element-wise and comma-joined.
     */
    public static String escapeId(Object name, boolean forbidQualified) {
        if (ValueKind.of(name) == ValueKind.LIST) {
            return ValueKind.elements(name).stream()
                    .map(n -> escapeId(n, forbidQualified))
                    .collect(Collectors.joining(", "));
        }
        String quoted = String.valueOf(name).replace("`", "``");
        if (!forbidQualified) {
            quoted = quoted.replace(".", "`.`");
        }
        return "`" + quoted + "`";
    }

    // ==================== Values ====================

    public static String escape(Object value) {
        return escape(value, false, LOCAL_TIME_ZONE);
    }

    /**
     * Formats a Java value as a MySQL literal.
     *
     * @param stringifyObjects render maps and unknown objects as their {@code toString()}
     *                         string literal instead of a {@code `k` = v} list
     * @param timeZone         {@code local}, {@code Z}, an offset like {@code +08:00}, or a zone id
     * @throws SqlConfigurationException if the type is not supported
     */
    public static String escape(Object value, boolean stringifyObjects, String timeZone) {
        return switch (ValueKind.of(value)) {
            case NULL -> "NULL";
            case BOOLEAN -> ((Boolean) value) ? "true" : "false";
            case NUMBER -> number((Number) value);
            case DATE -> escapeString(dateToString(value, timeZone));
            case BINARY -> binary(value);
            case STRING -> escapeString(value instanceof Enum<?> e ? e.name() : value.toString());
            case LIST -> listToValues(ValueKind.elements(value), timeZone);
            case RENDERABLE -> ((SqlRenderable) value).toSqlString();
            case MAP -> stringifyObjects
                    ? escapeString(value.toString())
                    : mapToValues((Map<?, ?>) value, timeZone);
            case OTHER -> {
                if (stringifyObjects) {
                    yield escapeString(value.toString());
                }
                throw new SqlConfigurationException(
                        "Unsupported literal type: " + value.getClass().getName());
            }
        };
    }

    /**
     * Quotes a string for MySQL. Escapes NUL, backspace, tab, newline, carriage return,
     * Ctrl-Z, double quote, single quote and backslash.
     */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\0' -> sb.append("\\0");
                case '\b' -> sb.append("\\b");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\u001a' -> sb.append("\\Z");
                case '"' -> sb.append("\\\"");
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    // ==================== Internal ====================

    private static String number(Number n) {
        if (n instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return "NULL";
        }
        if (n instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return "NULL";
        }
        if (n instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        return n.toString();
    }

    private static String listToValues(List<Object> elements, String timeZone) {
        return elements.stream()
                .map(e -> ValueKind.of(e) == ValueKind.LIST
                        ? "(" + listToValues(ValueKind.elements(e), timeZone) + ")"
                        : escape(e, true, timeZone))
                .collect(Collectors.joining(", "));
    }

    private static String mapToValues(Map<?, ?> map, String timeZone) {
        return map.entrySet().stream()
                .map(e -> escapeId(String.valueOf(e.getKey())) + " = "
                        + escape(e.getValue(), true, timeZone))
                .collect(Collectors.joining(", "));
    }

    private static String binary(Object value) {
        byte[] bytes;
        if (value instanceof ByteBuffer buffer) {
            ByteBuffer copy = buffer.duplicate();
            bytes = new byte[copy.remaining()];
            copy.get(bytes);
        } else {
            bytes = (byte[]) value;
        }
        return "X'" + HexFormat.of().formatHex(bytes) + "'";
    }

    static String dateToString(Object value, String timeZone) {
        if (value instanceof LocalDate ld) {
            return DATE.format(ld);
        }
        if (value instanceof LocalDateTime ldt) {
            return DATE_TIME.format(ldt);
        }
        if (value instanceof LocalTime lt) {
            return TIME.format(lt);
        }
        // java.sql.Date and java.sql.Time do not support toInstant()
        if (value instanceof java.sql.Date sqlDate) {
            return DATE.format(sqlDate.toLocalDate());
        }
        if (value instanceof java.sql.Time sqlTime) {
            return TIME.format(sqlTime.toLocalTime());
        }
        Instant instant;
        if (value instanceof Date d) {
            instant = d.toInstant();
        } else if (value instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (value instanceof ZonedDateTime zdt) {
            instant = zdt.toInstant();
        } else {
            instant = (Instant) value;
        }
        return DATE_TIME.format(instant.atZone(zone(timeZone)));
    }

    static ZoneId zone(String timeZone) {
        if (timeZone == null || LOCAL_TIME_ZONE.equals(timeZone)) {
            return ZoneId.systemDefault();
        }
        if ("Z".equalsIgnoreCase(timeZone)) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new SqlConfigurationException("Invalid time zone: " + timeZone, e);
        }
    }
}
