package com.enterprise.rds.spring;

import com.enterprise.rds.operator.SqlExecutor;
import com.enterprise.rds.operator.SqlOperator;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires a {@link SqlOperator} on top of the application's {@link JdbcTemplate}.
 * Import this configuration or let component scanning pick it up:
 * <pre>{@code
 * @Import(SqlOperatorConfig.class)
 * @Configuration
 * public class MyDbConfig { ... }
 * }</pre>
 *
 * <p>Declare your own {@link SqlExecutor} bean to swap the transport
 * (test doubles, a single-connection executor for table locks).
 */
@Configuration
@EnableConfigurationProperties(OperatorProperties.class)
public class SqlOperatorConfig {

    @Bean
    @ConditionalOnMissingBean
    public SqlExecutor sqlExecutor(JdbcTemplate jdbcTemplate) {
        return new JdbcSqlExecutor(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlOperator sqlOperator(SqlExecutor sqlExecutor, OperatorProperties properties) {
        return new SqlOperator(sqlExecutor, properties.isStringifyObjects(), properties.getTimeZone());
    }
}
