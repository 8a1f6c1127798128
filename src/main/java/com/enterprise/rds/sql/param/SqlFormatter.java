package com.enterprise.rds.sql.param;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands SQL templates against values, escaping everything through {@link SqlEscaper}.
 *
 * <p>Positional mode (values is a list, an array or a single scalar):
 * <pre>{@code
 * SqlFormatter.format("SELECT ?? FROM ?? WHERE ?? = ?", List.of(List.of("id", "name"), "posts", "id", 7))
 * // SELECT `id`, `name` FROM `posts` WHERE `id` = 7
 * }</pre>
 * {@code ??} takes the next value as an identifier, {@code ?} as a literal. Runs of three
 * or more question marks are left alone, and placeholders past the last value stay
 * in the text unchanged.
 *
 * <p>Named mode (values is a {@link Map}):
 * <pre>{@code
 * SqlFormatter.format("SELECT * FROM posts WHERE id = :id AND tag = :tag", Map.of("id", 7))
 * // SELECT * FROM posts WHERE id = 7 AND tag = :tag
 * }</pre>
 * Keys missing from the map leave their {@code :name} text untouched, so a template
 * can be filled in several passes. The same leniency hides typos in key names.
 */
public final class SqlFormatter {

    private static final Pattern POSITIONAL = Pattern.compile("\\?+");
    private static final Pattern NAMED = Pattern.compile(":(\\w+)");

    private SqlFormatter() {}

    public static String format(String template, Object values) {
        return format(template, values, false, SqlEscaper.LOCAL_TIME_ZONE);
    }

    public static String format(String template, Object values,
                                boolean stringifyObjects, String timeZone) {
        if (values instanceof Map<?, ?> named) {
            return formatNamed(template, named, stringifyObjects, timeZone);
        }
        if (values == null) {
            return template;
        }
        List<Object> positional = ValueKind.of(values) == ValueKind.LIST
                ? ValueKind.elements(values)
                : List.of(values);
        return formatPositional(template, positional, stringifyObjects, timeZone);
    }

    // ==================== Internal ====================

    private static String formatPositional(String template, List<Object> values,
                                           boolean stringifyObjects, String timeZone) {
        StringBuilder out = new StringBuilder(template.length());
        Matcher m = POSITIONAL.matcher(template);
        int chunkStart = 0;
        int valueIndex = 0;
        while (valueIndex < values.size() && m.find()) {
            int length = m.end() - m.start();
            if (length > 2) {
                continue;
            }
            Object value = values.get(valueIndex++);
            String replacement = length == 2
                    ? SqlEscaper.escapeId(value)
                    : SqlEscaper.escape(value, stringifyObjects, timeZone);
            out.append(template, chunkStart, m.start()).append(replacement);
            chunkStart = m.end();
        }
        return out.append(template, chunkStart, template.length()).toString();
    }

    private static String formatNamed(String template, Map<?, ?> values,
                                      boolean stringifyObjects, String timeZone) {
        StringBuilder out = new StringBuilder(template.length());
        Matcher m = NAMED.matcher(template);
        int chunkStart = 0;
        while (m.find()) {
            String key = m.group(1);
            if (!values.containsKey(key)) {
                continue;
            }
            out.append(template, chunkStart, m.start())
               .append(SqlEscaper.escape(values.get(key), stringifyObjects, timeZone));
            chunkStart = m.end();
        }
        return out.append(template, chunkStart, template.length()).toString();
    }
}
