package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.clause.ClauseBuilder;
import com.enterprise.rds.sql.param.SqlEscaper;
import com.enterprise.rds.sql.param.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Updates many rows with different values in one statement:
 * <pre>
 * UPDATE `posts` SET
 *   `title` = CASE WHEN `id` = 1 THEN 'a' WHEN `id` = 2 THEN 'b' ELSE `title` END,
 *   `views` = CASE WHEN `id` = 1 THEN 10 WHEN `id` = 2 THEN 20 ELSE `views` END
 * WHERE `id` IN (1, 2)
 * </pre>
 * (rendered on a single line). Each entry's where map becomes the WHEN condition of
 * every column the entry sets. The trailing WHERE is assembled from the distinct
 * values seen per where column across the batch, so the statement only touches rows
 * some entry addressed. Values count as the same when they render the same literal,
 * so {@code 1} and {@code 1L} appear once.
 *
 * <p>A builder accumulates one batch; create a new one per statement.
 */
public class UpdateRowsBuilder {

    private static final String WHERE_PREFIX = " WHERE ";

    private final ClauseBuilder clauses;
    private final Map<String, CaseAssignment> assignments = new LinkedHashMap<>();
    // where column -> rendered literal -> first value seen
    private final Map<String, Map<String, Object>> scope = new LinkedHashMap<>();

    public UpdateRowsBuilder(ClauseBuilder clauses) {
        this.clauses = clauses;
    }

    public UpdateRowsBuilder add(RowUpdate update) {
        String condition = condition(update.where());
        for (Map.Entry<String, ?> e : update.row().entrySet()) {
            assignments.computeIfAbsent(e.getKey(), CaseAssignment::new)
                       .when(condition, e.getValue());
        }
        for (Map.Entry<String, ?> e : update.where().entrySet()) {
            Map<String, Object> seen = scope.computeIfAbsent(e.getKey(), k -> new LinkedHashMap<>());
            Object value = e.getValue();
            List<Object> values = ValueKind.of(value) == ValueKind.LIST
                    ? ValueKind.elements(value)
                    : Collections.singletonList(value);
            for (Object v : values) {
                seen.putIfAbsent(SqlEscaper.escape(v, true, clauses.timeZone()), v);
            }
        }
        return this;
    }

    public UpdateRowsBuilder addAll(List<RowUpdate> updates) {
        for (RowUpdate update : updates) {
            add(update);
        }
        return this;
    }

    /**
     * @throws SqlConfigurationException if no entry sets any column
     */
    public String build(String table) {
        if (assignments.isEmpty()) {
            throw new SqlConfigurationException("updateRows has no column to update");
        }
        String sets = assignments.values().stream()
                .map(a -> a.toSql(clauses.timeZone()))
                .collect(Collectors.joining(", "));
        Map<String, List<Object>> where = new LinkedHashMap<>();
        scope.forEach((column, values) -> where.put(column, new ArrayList<>(values.values())));
        return "UPDATE " + SqlEscaper.escapeId(table) + " SET " + sets + clauses.where(where);
    }

    public Map<String, CaseAssignment> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    // the WHERE fragment reused as a bare condition inside WHEN
    private String condition(Map<String, ?> where) {
        String fragment = clauses.where(where);
        return fragment.startsWith(WHERE_PREFIX)
                ? fragment.substring(WHERE_PREFIX.length())
                : fragment;
    }
}
