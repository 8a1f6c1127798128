package com.enterprise.rds.spring;

import com.enterprise.rds.operator.SqlExecutor;

import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;

import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SqlExecutor} backed by Spring's {@link JdbcTemplate}.
 *
 * <p>Queries return one map per row ({@link ColumnMapRowMapper}, keys are
 * case-insensitive). Other statements return a single row {@code {affectedRows: n}}.
 * Failures surface as Spring {@code DataAccessException}s.
 *
 * <p>Each call borrows a connection from the template's DataSource, so LOCK TABLES and
 * UNLOCK TABLES only pair up when the DataSource hands out one session
 * (e.g. {@code SingleConnectionDataSource}).
 */
public class JdbcSqlExecutor implements SqlExecutor {

    public static final String AFFECTED_ROWS = "affectedRows";

    private final JdbcTemplate jdbcTemplate;

    public JdbcSqlExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    @Override
    public List<Map<String, Object>> execute(String sql) {
        return jdbcTemplate.execute((StatementCallback<List<Map<String, Object>>>) stmt -> {
            if (stmt.execute(sql)) {
                try (ResultSet rs = stmt.getResultSet()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                }
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(AFFECTED_ROWS, stmt.getUpdateCount());
            return List.of(result);
        });
    }
}
