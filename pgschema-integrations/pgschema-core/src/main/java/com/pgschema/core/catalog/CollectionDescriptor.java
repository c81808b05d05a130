package com.pgschema.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative definition of one metadata collection.
 *
 * <p>A descriptor is either <em>query-backed</em> (it carries a SQL template
 * plus the ordered list of columns a caller may restrict on) or
 * <em>static</em> (it carries its rows in memory and accepts no restrictions).
 * Descriptors are immutable and are built once at catalog construction:
 * <pre>
 *   CollectionDescriptor tables = CollectionDescriptor.builder("Tables")
 *       .addTextColumn("table_catalog")
 *       .addTextColumn("table_schema")
 *       .queryTemplate("SELECT ... FROM information_schema.tables")
 *       .restrictionColumns("table_catalog", "table_schema")
 *       .build();
 * </pre>
 */
public final class CollectionDescriptor {

    private final String                    name;
    private final List<ResultColumn>        resultColumns;
    private final String                    queryTemplate;
    private final List<String>              restrictionColumns;
    private final ClauseMode                clauseMode;
    private final int                       identifierParts;
    private final List<Map<String, Object>> staticRows;

    private CollectionDescriptor(Builder b) {
        this.name               = b.name;
        this.resultColumns      = List.copyOf(b.resultColumns);
        this.queryTemplate      = b.queryTemplate;
        this.restrictionColumns = List.copyOf(b.restrictionColumns);
        this.clauseMode         = b.clauseMode;
        this.identifierParts    = b.identifierParts;
        this.staticRows         = b.staticRows == null ? null : freeze(b.staticRows);
    }

    public String             getName()               { return name; }
    public List<ResultColumn> getResultColumns()      { return resultColumns; }
    public String             getQueryTemplate()      { return queryTemplate; }
    public List<String>       getRestrictionColumns() { return restrictionColumns; }
    public ClauseMode         getClauseMode()         { return clauseMode; }

    /** Number of name parts that identify one object of this collection (e.g. 3 for catalog.schema.table). */
    public int getIdentifierParts() { return identifierParts; }

    /** {@code true} when rows come from memory rather than from a query. */
    public boolean isStatic() { return staticRows != null; }

    /** Rows of a static collection; empty for a query-backed one. */
    public List<Map<String, Object>> getStaticRows() {
        return staticRows == null ? List.of() : staticRows;
    }

    public List<String> getResultColumnNames() {
        return resultColumns.stream().map(ResultColumn::getName).toList();
    }

    public CollectionSummary summary() {
        return new CollectionSummary(name, restrictionColumns);
    }

    @Override
    public String toString() {
        return "CollectionDescriptor{name='" + name + "', columns=" + resultColumns +
               ", restrictions=" + restrictionColumns + ", static=" + isStatic() + '}';
    }

    private static List<Map<String, Object>> freeze(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<ResultColumn> resultColumns      = new ArrayList<>();
        private final List<String>       restrictionColumns = new ArrayList<>();
        private String     queryTemplate;
        private ClauseMode clauseMode = ClauseMode.WHERE;
        private int        identifierParts;
        private List<Map<String, Object>> staticRows;

        private Builder(String name) {
            this.name = name;
        }

        public Builder addColumn(String n, ColumnType t)   { resultColumns.add(new ResultColumn(n, t)); return this; }
        public Builder addTextColumn(String n)             { return addColumn(n, ColumnType.STRING); }
        public Builder addIntColumn(String n)              { return addColumn(n, ColumnType.INTEGER); }
        public Builder addLongColumn(String n)             { return addColumn(n, ColumnType.LONG); }
        public Builder addBooleanColumn(String n)          { return addColumn(n, ColumnType.BOOLEAN); }
        public Builder queryTemplate(String sql)           { this.queryTemplate = sql; return this; }
        public Builder clauseMode(ClauseMode mode)         { this.clauseMode = mode; return this; }
        public Builder identifierParts(int parts)          { this.identifierParts = parts; return this; }
        public Builder restrictionColumns(String... names) { restrictionColumns.addAll(List.of(names)); return this; }
        public Builder staticRows(List<Map<String, Object>> rows) { this.staticRows = new ArrayList<>(rows); return this; }

        public CollectionDescriptor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("collection name must not be blank");
            }
            if (resultColumns.isEmpty()) {
                throw new IllegalStateException("Collection '" + name + "' declares no result columns");
            }
            if (clauseMode == null) {
                throw new IllegalStateException("Collection '" + name + "' has no clause mode");
            }
            boolean hasTemplate = queryTemplate != null && !queryTemplate.isBlank();
            if (hasTemplate == (staticRows != null)) {
                throw new IllegalStateException(
                        "Collection '" + name + "' needs exactly one of a query template or static rows");
            }
            if (staticRows != null && !restrictionColumns.isEmpty()) {
                throw new IllegalStateException("Static collection '" + name + "' cannot declare restrictions");
            }
            if (identifierParts < 0) {
                throw new IllegalStateException("Collection '" + name + "' has negative identifierParts");
            }
            Set<String> seen = new HashSet<>();
            for (String column : restrictionColumns) {
                if (column == null || column.isBlank() || !seen.add(column)) {
                    throw new IllegalStateException(
                            "Collection '" + name + "' has a blank or duplicate restriction column: " + column);
                }
            }
            return new CollectionDescriptor(this);
        }
    }
}
