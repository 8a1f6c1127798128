package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.clause.ClauseBuilder;
import com.enterprise.rds.sql.param.SqlFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes complete MySQL statements from structured input. Table and column names
 * always go through {@code ??}, values through {@code ?}, so nothing the caller passes
 * reaches the SQL text unescaped.
 *
 * <p>Stateless apart from the time zone used for date literals; one instance can be
 * shared across threads.
 *
 * <p>Example:
 * <pre>{@code
 * StatementComposer composer = new StatementComposer();
 * composer.select("posts", new SelectOptions()
 *         .where(Map.of("author", "fengmk2"))
 *         .orderBy(OrderBy.desc("id"))
 *         .limit(10));
 * // SELECT * FROM `posts` WHERE `author` = 'fengmk2' ORDER BY `id` DESC LIMIT 0, 10
 * }</pre>
 */
public class StatementComposer {

    private final ClauseBuilder clauses;

    public StatementComposer() {
        this(new ClauseBuilder());
    }

    public StatementComposer(ClauseBuilder clauses) {
        this.clauses = Objects.requireNonNull(clauses, "clauses");
    }

    public ClauseBuilder clauses() {
        return clauses;
    }

    // ==================== SELECT ====================

    public String count(String table, Map<String, ?> where) {
        return format("SELECT COUNT(*) AS count FROM ??", table(table)) + clauses.where(where);
    }

    public String select(String table, SelectOptions options) {
        SelectOptions opts = options == null ? new SelectOptions() : options;
        String head = opts.allColumns()
                ? format("SELECT * FROM ??", table(table))
                : format("SELECT ?? FROM ??", opts.columns(), table(table));
        return head
                + clauses.where(opts.where())
                + clauses.orderBy(opts.orders())
                + clauses.limit(opts.limit(), opts.offset());
    }

    /**
     * SELECT of at most one row; limit and offset of {@code options} are replaced,
     * the caller's instance is not modified.
     */
    public String get(String table, Map<String, ?> where, SelectOptions options) {
        SelectOptions opts = options == null ? new SelectOptions() : options;
        return select(table, opts.copyWithPage(where, 1, 0));
    }

    // ==================== INSERT ====================

    public String insert(String table, Map<String, ?> row, InsertOptions options) {
        if (row == null) {
            throw new SqlConfigurationException("No rows to insert into " + table);
        }
        return insert(table, Collections.singletonList(row), options);
    }

    /**
     * One multi-row statement: {@code INSERT INTO `t`(`a`, `b`) VALUES (1, 2), (3, 4)}.
     * Every row is read in the same column order; keys a row lacks render NULL.
     */
    public String insert(String table, List<? extends Map<String, ?>> rows, InsertOptions options) {
        if (rows == null || rows.isEmpty() || rows.get(0) == null) {
            throw new SqlConfigurationException("No rows to insert into " + table);
        }
        List<String> columns = options != null && options.columns() != null
                ? options.columns()
                : new ArrayList<>(rows.get(0).keySet());
        if (columns.isEmpty()) {
            throw new SqlConfigurationException("No columns to insert into " + table);
        }

        List<Object> params = new ArrayList<>();
        params.add(table(table));
        params.add(columns);
        List<String> tuples = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            List<Object> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                values.add(row == null ? null : row.get(column));
            }
            tuples.add("(?)");
            params.add(values);
        }
        return SqlFormatter.format("INSERT INTO ??(??) VALUES " + String.join(", ", tuples),
                params, false, clauses.timeZone());
    }

    // ==================== UPDATE ====================

    /**
     * {@code UPDATE `t` SET `a` = 1, `b` = 2 WHERE ...}. Without an explicit where the
     * row's {@code id} is the condition.
     *
     * @throws SqlConfigurationException if there is neither a where nor an {@code id}
     */
    public String update(String table, Map<String, ?> row, UpdateOptions options) {
        Objects.requireNonNull(row, "row");
        List<String> columns = options != null && options.columns() != null
                ? options.columns()
                : new ArrayList<>(row.keySet());
        Map<String, ?> where = options == null ? null : options.where();
        if (where == null || where.isEmpty()) {
            if (!row.containsKey(RowUpdate.ID)) {
                throw new SqlConfigurationException("Can not auto detect update condition, "
                        + "please set options.where, or make sure row.id exists");
            }
            where = Collections.singletonMap(RowUpdate.ID, row.get(RowUpdate.ID));
        }
        if (columns.isEmpty()) {
            throw new SqlConfigurationException("No columns to update in " + table);
        }

        List<String> sets = new ArrayList<>(columns.size());
        List<Object> values = new ArrayList<>(columns.size() * 2);
        for (String column : columns) {
            sets.add("?? = ?");
            values.add(column);
            values.add(row.get(column));
        }
        return format("UPDATE ?? SET ", table(table))
                + SqlFormatter.format(String.join(", ", sets), values, false, clauses.timeZone())
                + clauses.where(where);
    }

    /**
     * Batched conditional update, see {@link UpdateRowsBuilder}.
     *
     * @throws SqlConfigurationException on an empty batch or a batch with nothing to set
     */
    public String updateRows(String table, List<RowUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new SqlConfigurationException("updateRows needs at least one entry");
        }
        return new UpdateRowsBuilder(clauses).addAll(updates).build(table(table));
    }

    // ==================== DELETE ====================

    /**
     * Deletes matching rows. A null or empty where deletes every row of the table.
     */
    public String delete(String table, Map<String, ?> where) {
        return format("DELETE FROM ??", table(table)) + clauses.where(where);
    }

    // ==================== LOCK ====================

    public String locks(List<TableLock> locks) {
        return LockStatementBuilder.build(locks);
    }

    public String lockOne(String tableName, String lockType, String tableAlias) {
        return LockStatementBuilder.build(List.of(new TableLock(tableName, lockType, tableAlias)));
    }

    public String unlock() {
        return LockStatementBuilder.UNLOCK_TABLES;
    }

    // ==================== Internal ====================

    private String format(String template, Object... values) {
        return SqlFormatter.format(template, values, false, clauses.timeZone());
    }

    private static String table(String table) {
        if (table == null || table.isEmpty()) {
            throw new SqlConfigurationException("Table name must not be empty");
        }
        return table;
    }
}
