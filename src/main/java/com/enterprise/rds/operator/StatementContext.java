package com.enterprise.rds.operator;

import java.util.Arrays;
import java.util.Optional;

/**
 * Attached as a suppressed exception to executor failures so the SQL that failed shows
 * up in the stack trace without changing the failure's type:
 * <pre>
 * org.springframework.jdbc.BadSqlGrammarException: ...
 *     Suppressed: com.enterprise.rds.operator.StatementContext: sql: SELECT * FROM `missing`
 * </pre>
 */
public class StatementContext extends RuntimeException {

    private final String sql;

    public StatementContext(String sql) {
        super("sql: " + sql, null, false, false);
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /** SQL attached to the given failure, if any. */
    public static Optional<String> sqlOf(Throwable failure) {
        return Arrays.stream(failure.getSuppressed())
                .filter(StatementContext.class::isInstance)
                .map(s -> ((StatementContext) s).sql())
                .findFirst();
    }
}
