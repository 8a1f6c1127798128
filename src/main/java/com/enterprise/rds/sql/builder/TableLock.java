package com.enterprise.rds.sql.builder;

/**
 * One {@code tbl_name [AS alias] lock_type} entry of a LOCK TABLES statement.
 * The lock type is kept as text and validated when the statement is built.
 */
public record TableLock(String tableName, String lockType, String tableAlias) {

    public static TableLock of(String tableName, String lockType) {
        return new TableLock(tableName, lockType, null);
    }

    public static TableLock of(String tableName, LockType lockType) {
        return new TableLock(tableName, lockType.sql(), null);
    }

    public static TableLock of(String tableName, LockType lockType, String tableAlias) {
        return new TableLock(tableName, lockType.sql(), tableAlias);
    }
}
