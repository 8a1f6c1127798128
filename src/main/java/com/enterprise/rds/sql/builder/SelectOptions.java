package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.clause.OrderBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Options for SELECT statements. All parts are optional:
 * <pre>{@code
 * new SelectOptions()
 *     .columns("id", "title")
 *     .where(Map.of("author", "fengmk2"))
 *     .orderBy(OrderBy.desc("id"))
 *     .limit(10)
 *     .offset(20);
 * }</pre>
 * Columns default to {@code *}.
 */
public class SelectOptions {

    private List<String> columns = List.of();
    private Map<String, ?> where;
    private final List<OrderBy> orders = new ArrayList<>();
    private Integer limit;
    private Integer offset;

    public SelectOptions columns(String... columns) {
        return columns(Arrays.asList(columns));
    }

    public SelectOptions columns(List<String> columns) {
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        return this;
    }

    public SelectOptions where(Map<String, ?> where) {
        this.where = where;
        return this;
    }

    public SelectOptions orderBy(OrderBy... orders) {
        this.orders.addAll(Arrays.asList(orders));
        return this;
    }

    /** Shorthand for ordering by columns in the database default direction. */
    public SelectOptions orderBy(String... columns) {
        for (String column : columns) {
            this.orders.add(OrderBy.of(column));
        }
        return this;
    }

    public SelectOptions limit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public SelectOptions offset(Integer offset) {
        this.offset = offset;
        return this;
    }

    public List<String> columns() { return columns; }
    public Map<String, ?> where() { return where; }
    public List<OrderBy> orders() { return List.copyOf(orders); }
    public Integer limit() { return limit; }
    public Integer offset() { return offset; }

    /** True when no column list was given or the list is just {@code *}. */
    public boolean allColumns() {
        return columns.isEmpty() || (columns.size() == 1 && "*".equals(columns.get(0)));
    }

    /** Copy with the given page, leaving this instance untouched. */
    SelectOptions copyWithPage(Map<String, ?> where, int limit, int offset) {
        SelectOptions copy = new SelectOptions();
        copy.columns = columns;
        copy.where = where;
        copy.orders.addAll(orders);
        copy.limit = limit;
        copy.offset = offset;
        return copy;
    }

    @Override
    public String toString() {
        return "SelectOptions{columns=" + columns + ", where=" + where + ", orders=" + orders
                + ", limit=" + limit + ", offset=" + offset + "}";
    }
}
