package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LockStatementBuilderTest {

    @Test
    void lockTypeNormalizedToUpperCase() {
        assertThat(LockStatementBuilder.build(List.of(TableLock.of("t", "read"))))
                .isEqualTo("LOCK TABLES `t`  READ;");
    }

    @Test
    void severalTablesWithAlias() {
        String sql = LockStatementBuilder.build(List.of(
                new TableLock("posts", "write", "p"),
                TableLock.of("users", LockType.READ_LOCAL)));
        assertThat(sql).isEqualTo("LOCK TABLES `posts`  AS `p`  WRITE, `users`  READ LOCAL;");
    }

    @Test
    void everyLockType() {
        assertThat(LockType.parse("READ", "t")).isEqualTo(LockType.READ);
        assertThat(LockType.parse("Write", "t")).isEqualTo(LockType.WRITE);
        assertThat(LockType.parse("read local", "t")).isEqualTo(LockType.READ_LOCAL);
        assertThat(LockType.parse("LOW_PRIORITY write", "t")).isEqualTo(LockType.LOW_PRIORITY_WRITE);
    }

    @Test
    void emptyListRejected() {
        assertThatThrownBy(() -> LockStatementBuilder.build(List.of()))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessage("Cannot lock empty tables.");
    }

    @Test
    void missingTableNameRejected() {
        assertThatThrownBy(() -> LockStatementBuilder.build(List.of(new TableLock(null, "READ", null))))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessageContaining("No table_name");
    }

    @Test
    void missingLockTypeRejected() {
        assertThatThrownBy(() -> LockStatementBuilder.build(List.of(new TableLock("posts", null, null))))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessageContaining("No lock_type provided while trying to lock table `posts`");
    }

    @Test
    void unknownLockTypeRejected() {
        assertThatThrownBy(() -> LockStatementBuilder.build(List.of(TableLock.of("t", "bogus"))))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessageContaining("must be one of the following");
    }

    @Test
    void oneBadEntryRejectsWholeStatement() {
        assertThatThrownBy(() -> LockStatementBuilder.build(List.of(
                TableLock.of("a", "READ"), TableLock.of("b", "SHARE"))))
                .isInstanceOf(SqlConfigurationException.class);
    }
}
