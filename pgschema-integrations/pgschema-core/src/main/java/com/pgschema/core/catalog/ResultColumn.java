package com.pgschema.core.catalog;

import java.util.Objects;

/** A named, typed column of a metadata collection's result schema. */
public final class ResultColumn {

    private final String     name;
    private final ColumnType type;

    public ResultColumn(String name, ColumnType type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
    }

    public String     getName() { return name; }
    public ColumnType getType() { return type; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultColumn)) return false;
        ResultColumn that = (ResultColumn) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() { return Objects.hash(name, type); }

    @Override
    public String toString() { return name + ":" + type; }
}
