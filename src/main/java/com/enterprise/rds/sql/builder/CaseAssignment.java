package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.param.SqlEscaper;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code `col` = CASE WHEN cond THEN val ... ELSE `col` END} for one column of a
 * batched update. Branches render in the order they were added; rows without a
 * branch keep their current value through the ELSE.
 */
public class CaseAssignment {

    private final String column;
    private final List<WhenClause> whenClauses = new ArrayList<>();

    public CaseAssignment(String column) {
        this.column = column;
    }

    /**
     * @param condition rendered boolean condition, e.g. {@code `id` = 1}
     */
    public CaseAssignment when(String condition, Object value) {
        whenClauses.add(new WhenClause(condition, value));
        return this;
    }

    public String column() { return column; }

    public List<WhenClause> whenClauses() { return List.copyOf(whenClauses); }

    public String toSql(String timeZone) {
        String id = SqlEscaper.escapeId(column);
        StringBuilder sb = new StringBuilder(id).append(" = CASE");
        for (WhenClause w : whenClauses) {
            sb.append(" WHEN ").append(w.condition())
              .append(" THEN ").append(SqlEscaper.escape(w.value(), false, timeZone));
        }
        return sb.append(" ELSE ").append(id).append(" END").toString();
    }

    public record WhenClause(String condition, Object value) {}
}
