package com.pgschema.core.catalog;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Semantic type of a metadata result column.
 *
 * <p>Raw values handed back by a statement executor are coerced into the
 * column's Java type; {@code null} always stays {@code null}. Numeric
 * coercion is exact: a value that is out of range for the target type or
 * has a fractional part is rejected rather than truncated.
 */
public enum ColumnType {

    STRING(String.class) {
        @Override
        Object convert(Object raw) {
            return raw.toString();
        }
    },
    INTEGER(Integer.class) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Number n) return exact(n).intValueExact();
            return Integer.valueOf(raw.toString().trim());
        }
    },
    LONG(Long.class) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Number n) return exact(n).longValueExact();
            return Long.valueOf(raw.toString().trim());
        }
    },
    BOOLEAN(Boolean.class) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Boolean b) return b;
            String s = raw.toString().trim();
            // PostgreSQL renders booleans as t/f and information_schema as YES/NO
            return switch (s.toLowerCase(Locale.ROOT)) {
                case "true", "t", "yes", "y", "1"  -> Boolean.TRUE;
                case "false", "f", "no", "n", "0" -> Boolean.FALSE;
                default -> throw new IllegalArgumentException("Not a boolean value: '" + s + "'");
            };
        }
    };

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Coerces {@code raw} into this type's Java representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented exactly
     */
    public Object coerce(Object raw) {
        if (raw == null || javaType.isInstance(raw)) return raw;
        try {
            return convert(raw);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Cannot coerce '" + raw + "' to " + name(), e);
        }
    }

    abstract Object convert(Object raw);

    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Double || n instanceof Float) return new BigDecimal(n.toString());
        return BigDecimal.valueOf(n.longValue());
    }
}
