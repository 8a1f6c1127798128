package com.enterprise.rds.sql.param;

/**
 * A value that renders its own SQL text. The escaper inserts the result verbatim,
 * so implementations are responsible for their own safety.
 */
@FunctionalInterface
public interface SqlRenderable {
    String toSqlString();
}
