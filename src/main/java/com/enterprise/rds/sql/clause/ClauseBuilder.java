package com.enterprise.rds.sql.clause;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.param.SqlEscaper;
import com.enterprise.rds.sql.param.SqlFormatter;
import com.enterprise.rds.sql.param.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the WHERE, ORDER BY and LIMIT fragments of a statement. Each method returns
 * either an empty string or a fragment starting with a space, so clauses compose by
 * plain concatenation in the order WHERE → ORDER BY → LIMIT:
 * <pre>{@code
 * ClauseBuilder clauses = new ClauseBuilder();
 * String sql = "SELECT * FROM `posts`"
 *         + clauses.where(Map.of("author", "fengmk2"))
 *         + clauses.orderBy(List.of(OrderBy.desc("id")))
 *         + clauses.limit(10, 20);
 * // SELECT * FROM `posts` WHERE `author` = 'fengmk2' ORDER BY `id` DESC LIMIT 20, 10
 * }</pre>
 *
 * <p>An empty or null where map produces no WHERE clause at all, so callers composing
 * UPDATE or DELETE statements must check for it themselves.
 */
public class ClauseBuilder {

    private final String timeZone;

    public ClauseBuilder() {
        this(SqlEscaper.LOCAL_TIME_ZONE);
    }

    public ClauseBuilder(String timeZone) {
        this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
    }

    /**
     * {@code ` WHERE `a` = 1 AND `b` IN (2, 3) AND `c` IS NULL`} in map iteration order.
     * Collections and arrays become IN lists, nulls become IS NULL.
     *
     * @throws SqlConfigurationException if a condition is an empty collection
     */
    public String where(Map<String, ?> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return "";
        }
        List<String> fragments = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            Object value = entry.getValue();
            switch (ValueKind.of(value)) {
                case LIST -> {
                    if (ValueKind.elements(value).isEmpty()) {
                        throw new SqlConfigurationException(
                                "IN list must not be empty for column " + entry.getKey());
                    }
                    fragments.add("?? IN (?)");
                }
                case NULL -> fragments.add("?? IS ?");
                default -> fragments.add("?? = ?");
            }
            values.add(entry.getKey());
            values.add(value);
        }
        return SqlFormatter.format(" WHERE " + String.join(" AND ", fragments),
                values, false, timeZone);
    }

    /**
     * {@code ` ORDER BY `id` DESC, `name``}. Unknown directions are dropped.
     */
    public String orderBy(List<OrderBy> orders) {
        if (orders == null || orders.isEmpty()) {
            return "";
        }
        return " ORDER BY " + orders.stream()
                .map(o -> SqlEscaper.escapeId(o.column())
                        + o.normalizedDirection().map(d -> " " + d.name()).orElse(""))
                .collect(Collectors.joining(", "));
    }

    /**
     * {@code ` LIMIT offset, limit`}; empty when limit is null or zero.
     * A missing offset counts as zero.
     */
    public String limit(Integer limit, Integer offset) {
        if (limit == null || limit == 0) {
            return "";
        }
        return " LIMIT " + (offset == null ? 0 : offset) + ", " + limit;
    }

    public String timeZone() {
        return timeZone;
    }
}
