package com.enterprise.rds.sql.param;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SqlFormatterTest {

    // ==================== Positional ====================

    @Test
    void identifiersAndValues() {
        String sql = SqlFormatter.format("SELECT ?? FROM ?? WHERE ?? = ?",
                List.of(List.of("id", "title"), "posts", "id", 7));
        assertThat(sql).isEqualTo("SELECT `id`, `title` FROM `posts` WHERE `id` = 7");
    }

    @Test
    void listValueExpandsForIn() {
        assertThat(SqlFormatter.format("?? IN (?)", List.of("id", List.of(1, 2, 3))))
                .isEqualTo("`id` IN (1, 2, 3)");
    }

    @Test
    void nestedListValueExpandsToTuples() {
        assertThat(SqlFormatter.format("INSERT INTO t VALUES ?", List.of(List.of(List.of(1, "a"), List.of(2, "b")))))
                .isEqualTo("INSERT INTO t VALUES (1, 'a'), (2, 'b')");
    }

    @Test
    void missingValuesLeavePlaceholders() {
        assertThat(SqlFormatter.format("a = ? AND ?? = ?", List.of(1)))
                .isEqualTo("a = 1 AND ?? = ?");
    }

    @Test
    void extraValuesIgnored() {
        assertThat(SqlFormatter.format("a = ?", List.of(1, 2, 3))).isEqualTo("a = 1");
    }

    @Test
    void threeOrMoreQuestionMarksUntouched() {
        assertThat(SqlFormatter.format("x ??? y ?", List.of(5))).isEqualTo("x ??? y 5");
    }

    @Test
    void scalarIsSingleValue() {
        assertThat(SqlFormatter.format("id = ?", 7)).isEqualTo("id = 7");
    }

    @Test
    void arrayValues() {
        assertThat(SqlFormatter.format("? ?", new Object[] {"a", null})).isEqualTo("'a' NULL");
    }

    @Test
    void nullValuesReturnTemplate() {
        assertThat(SqlFormatter.format("id = ?", null)).isEqualTo("id = ?");
    }

    @Test
    void escapedOutputIsNotRescanned() {
        assertThat(SqlFormatter.format("? = ?", Arrays.asList("what?", "??")))
                .isEqualTo("'what?' = '??'");
    }

    @Test
    void timeZoneApplied() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");
        assertThat(SqlFormatter.format("?", List.of(instant), false, "+01:00"))
                .isEqualTo("'2024-01-01 01:00:00.000'");
    }

    // ==================== Named ====================

    @Test
    void namedValues() {
        assertThat(SqlFormatter.format("SELECT * FROM posts WHERE id = :id AND author = :author",
                Map.of("id", 1, "author", "fengmk2")))
                .isEqualTo("SELECT * FROM posts WHERE id = 1 AND author = 'fengmk2'");
    }

    @Test
    void namedMissingKeyLeftAsIs() {
        assertThat(SqlFormatter.format("select :a", Map.of())).isEqualTo("select :a");
        assertThat(SqlFormatter.format("select :a, :b", Map.of("a", 1))).isEqualTo("select 1, :b");
    }

    @Test
    void namedNullValue() {
        Map<String, Object> values = new HashMap<>();
        values.put("a", null);
        assertThat(SqlFormatter.format("select :a", values)).isEqualTo("select NULL");
    }

    @Test
    void namedRepeatedKey() {
        assertThat(SqlFormatter.format(":x + :x", Map.of("x", 2))).isEqualTo("2 + 2");
    }

    @Test
    void namedModeIgnoresQuestionMarks() {
        assertThat(SqlFormatter.format("select ?? , ? , :a", Map.of("a", "x")))
                .isEqualTo("select ?? , ? , 'x'");
    }

    @Test
    void namedValueEscaped() {
        assertThat(SqlFormatter.format("name = :name", Map.of("name", "x' OR 1=1 --")))
                .isEqualTo("name = 'x\\' OR 1=1 --'");
    }
}
