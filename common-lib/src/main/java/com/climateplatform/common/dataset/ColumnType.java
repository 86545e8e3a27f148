package com.climateplatform.common.dataset;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Scalar type of a {@link TabularDataset} column.
 *
 * <p>Cell values are normalized on the way into a dataset: numbers become {@link Double},
 * timestamps become {@link Instant} truncated to microseconds, strings stay {@link String}.
 * {@code null} is valid for every type.
 */
public enum ColumnType {
    NUMERIC,
    STRING,
    TIMESTAMP;

    /**
     * Infers the column type for a non-null cell value.
     *
     * @throws IllegalArgumentException if the value is not a supported scalar
     */
    public static ColumnType infer(Object value) {
        if (value instanceof Number) return NUMERIC;
        if (value instanceof Instant) return TIMESTAMP;
        if (value instanceof CharSequence || value instanceof Boolean) return STRING;
        throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
    }

    /**
     * Coerces a cell value into this type's canonical Java representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented in this type
     */
    public Object coerce(Object value) {
        if (value == null) return null;
        if (this == NUMERIC && value instanceof Number n) return n.doubleValue();
        if (this == TIMESTAMP && value instanceof Instant i) return i.truncatedTo(ChronoUnit.MICROS);
        if (this == STRING && (value instanceof CharSequence || value instanceof Boolean)) return value.toString();
        throw new IllegalArgumentException(
            "Value " + value + " (" + value.getClass().getSimpleName() + ") is not a " + this + " cell");
    }
}
