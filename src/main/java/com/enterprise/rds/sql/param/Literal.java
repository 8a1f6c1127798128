package com.enterprise.rds.sql.param;

import java.util.Objects;

/**
 * Verbatim SQL expression used as a value, e.g. {@code now()}.
 *
 * <pre>{@code
 * operator.insert("posts", Map.of("title", "hi", "created_at", Literals.NOW));
 * // INSERT INTO `posts`(`title`, `created_at`) VALUES ('hi', now())
 * }</pre>
 */
public record Literal(String text) implements SqlRenderable {

    public Literal {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toSqlString() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
