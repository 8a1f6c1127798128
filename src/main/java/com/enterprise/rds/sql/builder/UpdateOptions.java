package com.enterprise.rds.sql.builder;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Options for single-statement UPDATE. Columns default to the keys of the row;
 * the condition defaults to {@code id = row.id}.
 */
public class UpdateOptions {

    private List<String> columns;
    private Map<String, ?> where;

    public UpdateOptions columns(String... columns) {
        return columns(Arrays.asList(columns));
    }

    public UpdateOptions columns(List<String> columns) {
        this.columns = columns == null ? null : List.copyOf(columns);
        return this;
    }

    public UpdateOptions where(Map<String, ?> where) {
        this.where = where;
        return this;
    }

    public List<String> columns() { return columns; }
    public Map<String, ?> where() { return where; }

    @Override
    public String toString() {
        return "UpdateOptions{columns=" + columns + ", where=" + where + "}";
    }
}
