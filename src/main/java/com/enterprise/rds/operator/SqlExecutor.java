package com.enterprise.rds.operator;

import java.util.List;
import java.util.Map;

/**
 * Runs finished SQL text against a database session and returns the resulting rows.
 *
 * <p>Statements without a result set (INSERT, UPDATE, DELETE, LOCK) return
 * implementation-defined rows describing the outcome, e.g. a single
 * {@code {affectedRows: 3}} row.
 *
 * <p>Implementations decide the session semantics: table locks taken through a
 * pooled executor only hold for the connection that ran them.
 */
@FunctionalInterface
public interface SqlExecutor {

    /** Executor for operators that are only used to compose SQL. Fails on every call. */
    SqlExecutor UNSUPPORTED = sql -> {
        throw new UnsupportedOperationException("No SqlExecutor configured, cannot run: " + sql);
    };

    List<Map<String, Object>> execute(String sql);
}
