package com.enterprise.rds.sql.param;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Closed classification of the values {@link SqlEscaper} knows how to render.
 * Every value is mapped to exactly one kind; the escaper switches over the kind.
 */
public enum ValueKind {
    NULL,
    BOOLEAN,
    NUMBER,
    DATE,
    BINARY,
    STRING,
    LIST,
    RENDERABLE,
    MAP,
    OTHER;

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        // checked first: a renderable may also be a Map or a CharSequence
        if (value instanceof SqlRenderable) {
            return RENDERABLE;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Date || value instanceof Instant
                || value instanceof LocalDateTime || value instanceof LocalDate
                || value instanceof LocalTime
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
            return DATE;
        }
        if (value instanceof byte[] || value instanceof ByteBuffer) {
            return BINARY;
        }
        if (value instanceof CharSequence || value instanceof Character
                || value instanceof Enum<?> || value instanceof UUID) {
            return STRING;
        }
        if (value instanceof Collection<?> || value instanceof Object[]
                || value instanceof int[] || value instanceof long[]
                || value instanceof double[] || value instanceof float[]
                || value instanceof short[] || value instanceof char[]
                || value instanceof boolean[]) {
            return LIST;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        return OTHER;
    }

    /**
     * Elements of a {@link #LIST} value, primitive arrays boxed.
     */
    public static List<Object> elements(Object value) {
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        if (value instanceof int[] array) {
            return new ArrayList<>(Arrays.stream(array).boxed().toList());
        }
        if (value instanceof long[] array) {
            return new ArrayList<>(Arrays.stream(array).boxed().toList());
        }
        if (value instanceof double[] array) {
            return new ArrayList<>(Arrays.stream(array).boxed().toList());
        }
        List<Object> out = new ArrayList<>();
        if (value instanceof float[] array) {
            for (float f : array) {
                out.add(f);
            }
        } else if (value instanceof short[] array) {
            for (short v : array) {
                out.add(v);
            }
        } else if (value instanceof char[] array) {
            for (char ch : array) {
                out.add(ch);
            }
        } else if (value instanceof boolean[] array) {
            for (boolean b : array) {
                out.add(b);
            }
        } else {
            throw new IllegalArgumentException("Not a list value: " + value);
        }
        return out;
    }
}
