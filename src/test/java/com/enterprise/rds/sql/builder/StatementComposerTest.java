package com.enterprise.rds.sql.builder;

import com.enterprise.rds.sql.SqlConfigurationException;
import com.enterprise.rds.sql.clause.OrderBy;
import com.enterprise.rds.sql.param.Literals;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * SQL text produced for each statement type.
 */
class StatementComposerTest {

    private final StatementComposer composer = new StatementComposer();

    // ==================== COUNT / SELECT / GET ====================

    @Test
    void count() {
        assertThat(composer.count("posts", Map.of("author", "fengmk2")))
                .isEqualTo("SELECT COUNT(*) AS count FROM `posts` WHERE `author` = 'fengmk2'");
    }

    @Test
    void countWithoutWhere() {
        assertThat(composer.count("posts", null)).isEqualTo("SELECT COUNT(*) AS count FROM `posts`");
    }

    @Test
    void selectAllColumnsByDefault() {
        assertThat(composer.select("posts", null)).isEqualTo("SELECT * FROM `posts`");
        assertThat(composer.select("posts", new SelectOptions().columns("*")))
                .isEqualTo("SELECT * FROM `posts`");
    }

    @Test
    void selectWithEveryClause() {
        String sql = composer.select("posts", new SelectOptions()
                .columns("id", "title")
                .where(Map.of("author", "fengmk2"))
                .orderBy(OrderBy.desc("id"))
                .limit(10)
                .offset(20));
        assertThat(sql).isEqualTo(
                "SELECT `id`, `title` FROM `posts` WHERE `author` = 'fengmk2' ORDER BY `id` DESC LIMIT 20, 10");
    }

    @Test
    void selectOrderByColumnNames() {
        String sql = composer.select("posts", new SelectOptions().orderBy("author", "id"));
        assertThat(sql).isEqualTo("SELECT * FROM `posts` ORDER BY `author`, `id`");
    }

    @Test
    void getForcesSingleRowWithoutTouchingOptions() {
        SelectOptions options = new SelectOptions().columns("id").limit(50).offset(3);
        String sql = composer.get("posts", Map.of("id", 1), options);
        assertThat(sql).isEqualTo("SELECT `id` FROM `posts` WHERE `id` = 1 LIMIT 0, 1");
        assertThat(options.limit()).isEqualTo(50);
        assertThat(options.offset()).isEqualTo(3);
        assertThat(options.where()).isNull();
    }

    @Test
    void emptyTableNameRejected() {
        assertThatThrownBy(() -> composer.select("", null))
                .isInstanceOf(SqlConfigurationException.class);
    }

    // ==================== INSERT ====================

    @Test
    void insertSingleRow() {
        assertThat(composer.insert("posts", Map.of("title", "hi"), null))
                .isEqualTo("INSERT INTO `posts`(`title`) VALUES ('hi')");
    }

    @Test
    void insertMultipleRowsUsesFirstRowColumnOrder() {
        String sql = composer.insert("t", List.of(row("a", 1, "b", 2), row("b", 4, "a", 3)), null);
        assertThat(sql).isEqualTo("INSERT INTO `t`(`a`, `b`) VALUES (1, 2), (3, 4)");
    }

    @Test
    void insertMissingKeyIsNull() {
        String sql = composer.insert("t", List.of(row("a", 1, "b", 2), Map.of("a", 3)), null);
        assertThat(sql).isEqualTo("INSERT INTO `t`(`a`, `b`) VALUES (1, 2), (3, NULL)");
    }

    @Test
    void insertExplicitColumns() {
        String sql = composer.insert("t", row("a", 1, "b", 2), new InsertOptions().columns("b"));
        assertThat(sql).isEqualTo("INSERT INTO `t`(`b`) VALUES (2)");
    }

    @Test
    void insertLiteralValue() {
        String sql = composer.insert("posts", row("title", "hi", "created_at", Literals.NOW), null);
        assertThat(sql).isEqualTo("INSERT INTO `posts`(`title`, `created_at`) VALUES ('hi', now())");
    }

    @Test
    void insertNothingRejected() {
        assertThatThrownBy(() -> composer.insert("t", List.of(), null))
                .isInstanceOf(SqlConfigurationException.class);
        assertThatThrownBy(() -> composer.insert("t", Map.of(), null))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessageContaining("No columns");
    }

    // ==================== UPDATE ====================

    @Test
    void updateDefaultsToIdCondition() {
        assertThat(composer.update("t", row("id", 7, "name", "x"), null))
                .isEqualTo("UPDATE `t` SET `id` = 7, `name` = 'x' WHERE `id` = 7");
    }

    @Test
    void updateWithoutIdOrWhereRejected() {
        assertThatThrownBy(() -> composer.update("t", Map.of("name", "x"), null))
                .isInstanceOf(SqlConfigurationException.class)
                .hasMessageContaining("Can not auto detect update condition");
        assertThatThrownBy(() -> composer.update("t", Map.of("name", "x"), new UpdateOptions().where(Map.of())))
                .isInstanceOf(SqlConfigurationException.class);
    }

    @Test
    void updateWithColumnsAndWhere() {
        String sql = composer.update("posts", row("title", "x", "views", 3),
                new UpdateOptions().columns("views").where(Map.of("title", "x")));
        assertThat(sql).isEqualTo("UPDATE `posts` SET `views` = 3 WHERE `title` = 'x'");
    }

    @Test
    void updateNullValue() {
        assertThat(composer.update("t", row("id", 1, "deleted_at", null), null))
                .isEqualTo("UPDATE `t` SET `id` = 1, `deleted_at` = NULL WHERE `id` = 1");
    }

    // ==================== DELETE ====================

    @Test
    void deleteWithWhere() {
        assertThat(composer.delete("t", Map.of("id", List.of(1, 2))))
                .isEqualTo("DELETE FROM `t` WHERE `id` IN (1, 2)");
    }

    @Test
    void timeOfDayRendersTheSameInWhereAndValues() {
        assertThat(composer.delete("t", Map.of("at", LocalTime.NOON)))
                .isEqualTo("DELETE FROM `t` WHERE `at` = '12:00:00'");
        assertThat(composer.insert("t", Map.of("at", LocalTime.NOON), null))
                .isEqualTo("INSERT INTO `t`(`at`) VALUES ('12:00:00')");
    }

    @Test
    void deleteWithoutWhereDeletesEverything() {
        assertThat(composer.delete("t", null)).isEqualTo("DELETE FROM `t`");
    }

    // ==================== LOCK ====================

    @Test
    void lockOne() {
        assertThat(composer.lockOne("t", "read", null)).isEqualTo("LOCK TABLES `t`  READ;");
        assertThat(composer.lockOne("t", "low_priority write", "a"))
                .isEqualTo("LOCK TABLES `t`  AS `a`  LOW_PRIORITY WRITE;");
    }

    @Test
    void unlock() {
        assertThat(composer.unlock()).isEqualTo("UNLOCK TABLES;");
    }

    static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
