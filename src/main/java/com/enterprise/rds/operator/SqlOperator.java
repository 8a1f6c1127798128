package com.enterprise.rds.operator;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.builder.InsertOptions;
import com.enterprise.rds.sql.builder.RowUpdate;
import com.enterprise.rds.sql.builder.SelectOptions;
import com.enterprise.rds.sql.builder.StatementComposer;
import com.enterprise.rds.sql.builder.TableLock;
import com.enterprise.rds.sql.builder.UpdateOptions;
import com.enterprise.rds.sql.clause.ClauseBuilder;
import com.enterprise.rds.sql.param.SqlEscaper;
import com.enterprise.rds.sql.param.SqlFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes statements with {@link StatementComposer} and runs each of them through a
 * {@link SqlExecutor}. Every operation issues exactly one {@link SqlExecutor#execute}
 * call; invalid input fails with {@link SqlConfigurationException} before anything is
 * sent.
 *
 * <p>Typical usage:
 * <pre>{@code
 * SqlOperator db = new SqlOperator(new JdbcSqlExecutor(jdbcTemplate));
 *
 * db.insert("posts", Map.of("title", "hello", "author", "fengmk2"));
 * Map<String, Object> post = db.get("posts", Map.of("title", "hello"));
 * long total = db.count("posts", Map.of("author", "fengmk2"));
 * db.updateRows("posts", List.of(
 *         RowUpdate.byId(Map.of("id", 1, "title", "a")),
 *         RowUpdate.byId(Map.of("id", 2, "title", "b"))));
 * }</pre>
 *
 * <p>Executor failures propagate with their original type; the failing SQL is attached
 * as a suppressed {@link StatementContext}. Nothing is retried.
 */
public class SqlOperator {

    private static final Logger log = LoggerFactory.getLogger(SqlOperator.class);

    private final SqlExecutor executor;
    private final StatementComposer composer;
    private final boolean stringifyObjects;
    private final String timeZone;

    public SqlOperator(SqlExecutor executor) {
        this(executor, false, SqlEscaper.LOCAL_TIME_ZONE);
    }

    /**
     * @param stringifyObjects default for {@link #format} and {@link #escape}
     * @param timeZone         time zone of date literals in every composed statement
     */
    public SqlOperator(SqlExecutor executor, boolean stringifyObjects, String timeZone) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.stringifyObjects = stringifyObjects;
        this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
        this.composer = new StatementComposer(new ClauseBuilder(timeZone));
    }

    public StatementComposer composer() {
        return composer;
    }

    // ==================== Escaping ====================

    public String escape(Object value) {
        return SqlEscaper.escape(value, stringifyObjects, timeZone);
    }

    public String escapeId(Object name) {
        return SqlEscaper.escapeId(name);
    }

    public String escapeId(Object name, boolean forbidQualified) {
        return SqlEscaper.escapeId(name, forbidQualified);
    }

    /**
     * See {@link SqlFormatter}: a {@link Map} fills {@code :name} placeholders, anything
     * else fills {@code ?} and {@code ??} positionally.
     */
    public String format(String sql, Object values) {
        return SqlFormatter.format(sql, values, stringifyObjects, timeZone);
    }

    // ==================== Raw queries ====================

    public List<Map<String, Object>> query(String sql) {
        log.debug("query {}", sql);
        try {
            List<Map<String, Object>> rows = executor.execute(sql);
            if (rows == null) {
                rows = List.of();
            }
            log.debug("query get {} rows", rows.size());
            return rows;
        } catch (RuntimeException e) {
            e.addSuppressed(new StatementContext(sql));
            log.debug("query error: {}", e.toString());
            throw e;
        }
    }

    public List<Map<String, Object>> query(String sql, Object values) {
        return query(format(sql, values));
    }

    /** First row of the result, or null. */
    public Map<String, Object> queryOne(String sql, Object values) {
        return first(query(sql, values));
    }

    // ==================== Statements ====================

    public long count(String table, Map<String, ?> where) {
        String sql = composer.count(table, where);
        log.debug("count({}, {}) => {}", table, where, sql);
        List<Map<String, Object>> rows = query(sql);
        if (rows.isEmpty()) {
            throw new IllegalStateException("COUNT returned no rows: " + sql);
        }
        Object count = rows.get(0).get("count");
        if (!(count instanceof Number n)) {
            throw new IllegalStateException("COUNT returned no numeric count column: " + rows.get(0));
        }
        return n.longValue();
    }

    public List<Map<String, Object>> select(String table) {
        return select(table, null);
    }

    public List<Map<String, Object>> select(String table, SelectOptions options) {
        String sql = composer.select(table, options);
        log.debug("select({}, {}) => {}", table, options, sql);
        return query(sql);
    }

    public Map<String, Object> get(String table, Map<String, ?> where) {
        return get(table, where, null);
    }

    /** First matching row, or null. */
    public Map<String, Object> get(String table, Map<String, ?> where, SelectOptions options) {
        String sql = composer.get(table, where, options);
        log.debug("get({}, {}, {}) => {}", table, where, options, sql);
        return first(query(sql));
    }

    public List<Map<String, Object>> insert(String table, Map<String, ?> row) {
        return insert(table, row, null);
    }

    public List<Map<String, Object>> insert(String table, Map<String, ?> row, InsertOptions options) {
        String sql = composer.insert(table, row, options);
        log.debug("insert({}, {}, {}) => {}", table, row, options, sql);
        return query(sql);
    }

    public List<Map<String, Object>> insert(String table, List<? extends Map<String, ?>> rows) {
        return insert(table, rows, null);
    }

    public List<Map<String, Object>> insert(String table, List<? extends Map<String, ?>> rows,
                                            InsertOptions options) {
        String sql = composer.insert(table, rows, options);
        log.debug("insert({}, {}, {}) => {}", table, rows, options, sql);
        return query(sql);
    }

    public List<Map<String, Object>> update(String table, Map<String, ?> row) {
        return update(table, row, null);
    }

    public List<Map<String, Object>> update(String table, Map<String, ?> row, UpdateOptions options) {
        String sql = composer.update(table, row, options);
        log.debug("update({}, {}, {}) => {}", table, row, options, sql);
        return query(sql);
    }

    /**
     * Updates every entry's row in one statement. Map-shaped input converts with
     * {@link RowUpdate#from(Map)}.
     */
    public List<Map<String, Object>> updateRows(String table, List<RowUpdate> updates) {
        String sql = composer.updateRows(table, updates);
        log.debug("updateRows({}, {}) => {}", table, updates, sql);
        return query(sql);
    }

    /** Deletes matching rows; a null or empty where empties the table. */
    public List<Map<String, Object>> delete(String table, Map<String, ?> where) {
        String sql = composer.delete(table, where);
        log.debug("delete({}, {}) => {}", table, where, sql);
        return query(sql);
    }

    // ==================== Table locks ====================

    /**
     * LOCK TABLES for every entry. The locks belong to the executor's session and stay
     * until {@link #unlock()} runs on that session or it disconnects.
     */
    public List<Map<String, Object>> locks(List<TableLock> tables) {
        String sql = composer.locks(tables);
        log.debug("lock tables => {}", sql);
        return query(sql);
    }

    public List<Map<String, Object>> lockOne(String tableName, String lockType) {
        return lockOne(tableName, lockType, null);
    }

    public List<Map<String, Object>> lockOne(String tableName, String lockType, String tableAlias) {
        String sql = composer.lockOne(tableName, lockType, tableAlias);
        log.debug("lock one table => {}", sql);
        return query(sql);
    }

    /** Releases every table lock held by the current session. */
    public List<Map<String, Object>> unlock() {
        log.debug("unlock tables");
        return query(composer.unlock());
    }

    // ==================== Internal ====================

    private static Map<String, Object> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? null : rows.get(0);
    }
}
