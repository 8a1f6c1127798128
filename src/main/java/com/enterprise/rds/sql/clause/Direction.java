package com.enterprise.rds.sql.clause;

import java.util.Locale;
import java.util.Optional;

/**
 * ASC / DESC for ORDER BY clauses.
 */
public enum Direction {
    ASC,
    DESC;

    /**
     * Case-insensitive lookup; anything other than asc/desc, surrounding whitespace
     * included, yields empty so the database default ordering applies.
     */
    public static Optional<Direction> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return switch (text.toUpperCase(Locale.ROOT)) {
            case "ASC" -> Optional.of(ASC);
            case "DESC" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
