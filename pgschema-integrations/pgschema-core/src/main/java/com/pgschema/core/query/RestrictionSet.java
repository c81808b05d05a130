package com.pgschema.core.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, positional restriction values for one collection request.
 *
 * <p>Position {@code i} filters on the collection's {@code i}-th restriction
 * column. An entry is <em>present</em> when it is neither {@code null} nor
 * empty; absent entries keep their slot so later entries stay aligned:
 * <pre>
 *   // Tables restricted on table_schema only
 *   RestrictionSet.of(null, "public")
 *   RestrictionSet.of("", "public", "", "")
 * </pre>
 */
public final class RestrictionSet {

    private static final RestrictionSet EMPTY = new RestrictionSet(List.of());

    private final List<String> values;

    private RestrictionSet(List<String> values) {
        this.values = values;
    }

    public static RestrictionSet empty() {
        return EMPTY;
    }

    /** Creates a set from positional values; {@code null} array or entries are allowed. */
    public static RestrictionSet of(String... values) {
        if (values == null || values.length == 0) return EMPTY;
        return new RestrictionSet(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))));
    }

    public static RestrictionSet of(List<String> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new RestrictionSet(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /** Number of positions, present or not. */
    public int size() { return values.size(); }

    /** Raw value at {@code index}, or {@code null} beyond the end. */
    public String get(int index) {
        return index < values.size() ? values.get(index) : null;
    }

    public boolean isPresent(int index) {
        String v = get(index);
        return v != null && !v.isEmpty();
    }

    /** Number of present entries. */
    public int presentCount() {
        int n = 0;
        for (int i = 0; i < values.size(); i++) {
            if (isPresent(i)) n++;
        }
        return n;
    }

    public List<String> values() { return values; }

    @Override
    public boolean equals(Object o) {
        return o instanceof RestrictionSet && values.equals(((RestrictionSet) o).values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "RestrictionSet" + values; }
}
