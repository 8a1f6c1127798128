package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;

import java.util.Locale;

/**
 * MySQL {@code LOCK TABLES} lock types.
 */
public enum LockType {
    READ("READ"),
    READ_LOCAL("READ LOCAL"),
    WRITE("WRITE"),
    LOW_PRIORITY_WRITE("LOW_PRIORITY WRITE");

    private final String sql;

    LockType(String sql) { this.sql = sql; }

    public String sql() { return sql; }

    /**
     * Case-insensitive match on the SQL text, e.g. {@code "read local"}.
     *
     * @throws SqlConfigurationException for anything outside the four lock types
     */
    public static LockType parse(String text, String tableName) {
        if (text == null || text.isEmpty()) {
            throw new SqlConfigurationException(
                    "No lock_type provided while trying to lock table `" + tableName + "`");
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (LockType type : values()) {
            if (type.sql.equals(upper)) {
                return type;
            }
        }
        throw new SqlConfigurationException("lock_type provided while trying to lock table `"
                + tableName + "` must be one of the following (case insensitive): "
                + "`READ` | `WRITE` | `READ LOCAL` | `LOW_PRIORITY WRITE`");
    }
}
