package com.enterprise.rds.sql.builder;

import java.util.Arrays;
import java.util.List;

/**
 * Options for INSERT statements. Columns default to the keys of the first row.
 */
public class InsertOptions {

    private List<String> columns;

    public InsertOptions columns(String... columns) {
        return columns(Arrays.asList(columns));
    }

    public InsertOptions columns(List<String> columns) {
        this.columns = columns == null ? null : List.copyOf(columns);
        return this;
    }

    public List<String> columns() { return columns; }

    @Override
    public String toString() {
        return "InsertOptions{columns=" + columns + "}";
    }
}
