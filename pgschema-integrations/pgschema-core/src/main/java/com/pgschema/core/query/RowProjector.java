package com.pgschema.core.query;

import com.pgschema.core.catalog.ResultColumn;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shapes raw executor rows to a collection's declared result columns.
 *
 * <p>Only declared columns are kept, in declared order. Raw labels are matched
 * case-insensitively since drivers differ in how they fold unquoted
 * identifiers; a declared column missing from a raw row projects as
 * {@code null}.
 */
final class RowProjector {

    private final List<ResultColumn> columns;

    RowProjector(List<ResultColumn> columns) {
        this.columns = columns;
    }

    /**
     * @throws IllegalArgumentException if a value cannot be coerced to its column type
     */
    Map<String, Object> project(Map<String, Object> raw) {
        Map<String, Object> folded = new HashMap<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            folded.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }

        Map<String, Object> row = new LinkedHashMap<>();
        for (ResultColumn column : columns) {
            Object value = raw.containsKey(column.getName())
                    ? raw.get(column.getName())
                    : folded.get(column.getName().toLowerCase(Locale.ROOT));
            try {
                row.put(column.getName(), column.getType().coerce(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Column " + column.getName() + ": " + e.getMessage(), e);
            }
        }
        return row;
    }
}
