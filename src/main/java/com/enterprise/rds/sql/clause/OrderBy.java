package com.enterprise.rds.sql.clause;

import java.util.Objects;
import java.util.Optional;

/**
 * One ORDER BY item. The direction is kept as given and normalized on rendering,
 * so {@code "desc"} and {@code "DESC"} both render {@code DESC}. Unrecognized
 * directions, padded ones like {@code " desc "} among them, are dropped.
 */
public record OrderBy(String column, String direction) {

    public OrderBy {
        Objects.requireNonNull(column, "column");
    }

    public static OrderBy of(String column) {
        return new OrderBy(column, null);
    }

    public static OrderBy of(String column, String direction) {
        return new OrderBy(column, direction);
    }

    public static OrderBy asc(String column) {
        return new OrderBy(column, Direction.ASC.name());
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, Direction.DESC.name());
    }

    public Optional<Direction> normalizedDirection() {
        return Direction.parse(direction);
    }
}
