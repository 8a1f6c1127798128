package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.param.SqlEscaper;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds MySQL table lock statements:
 * <pre>
 * LOCK TABLES
 *   tbl_name [[AS] alias] lock_type
 *   [, tbl_name [[AS] alias] lock_type] ...
 * lock_type: { READ [LOCAL] | [LOW_PRIORITY] WRITE }
 * </pre>
 * Lock types are matched case-insensitively and rendered upper case:
 * {@code [TableLock.of("posts", "read")]} → {@code LOCK TABLES `posts`  READ;}.
 */
public final class LockStatementBuilder {

    public static final String UNLOCK_TABLES = "UNLOCK TABLES;";

    private LockStatementBuilder() {}

    /**
     * @throws SqlConfigurationException on an empty list, a missing table name or
     *                                   lock type, or an unknown lock type
     */
    public static String build(List<TableLock> locks) {
        if (locks == null || locks.isEmpty()) {
            throw new SqlConfigurationException("Cannot lock empty tables.");
        }
        return "LOCK TABLES " + locks.stream()
                .map(LockStatementBuilder::entry)
                .collect(Collectors.joining(", ")) + ";";
    }

    private static String entry(TableLock lock) {
        if (lock == null || lock.tableName() == null || lock.tableName().isEmpty()) {
            throw new SqlConfigurationException("No table_name provided while trying to lock table");
        }
        LockType type = LockType.parse(lock.lockType(), lock.tableName());
        StringBuilder sb = new StringBuilder(SqlEscaper.escapeId(lock.tableName())).append(' ');
        if (lock.tableAlias() != null && !lock.tableAlias().isEmpty()) {
            sb.append(" AS ").append(SqlEscaper.escapeId(lock.tableAlias())).append(' ');
        }
        return sb.append(' ').append(type.sql()).toString();
    }
}
