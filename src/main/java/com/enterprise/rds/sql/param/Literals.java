package com.enterprise.rds.sql.param;

/**
 * Commonly used {@link Literal} values.
 */
public final class Literals {

    private Literals() {}

    public static final Literal NOW = new Literal("now()");

    public static Literal of(String text) {
        return new Literal(text);
    }
}
