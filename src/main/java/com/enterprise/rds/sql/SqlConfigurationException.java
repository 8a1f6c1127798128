package com.enterprise.rds.sql;

/**
 * Caller misuse detected while composing a statement. Always thrown before any
 * SQL text reaches the executor.
 */
public class SqlConfigurationException extends IllegalArgumentException {

    public SqlConfigurationException(String message) {
        super(message);
    }

    public SqlConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
