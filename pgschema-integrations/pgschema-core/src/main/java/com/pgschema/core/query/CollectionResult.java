package com.pgschema.core.query;

import com.pgschema.core.catalog.ResultColumn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of one metadata collection, tagged with the collection's declared schema.
 *
 * <p>Each row is a {@code Map<columnName, value>} whose keys are exactly the
 * declared result columns, in declared order, with values already coerced to
 * the column types.
 */
public final class CollectionResult {

    private final String                    collectionName;
    private final List<ResultColumn>        columns;
    private final List<Map<String, Object>> rows;

    private CollectionResult(Builder b) {
        this.collectionName = b.collectionName;
        this.columns        = List.copyOf(b.columns);
        this.rows           = Collections.unmodifiableList(new ArrayList<>(b.rows));
    }

    public String                    getCollectionName() { return collectionName; }
    public List<ResultColumn>        getColumns()        { return columns; }
    public List<Map<String, Object>> getRows()           { return rows; }
    public int                       getRowCount()       { return rows.size(); }

    public List<String> getColumnNames() {
        return columns.stream().map(ResultColumn::getName).toList();
    }

    /** Values of one column across all rows, in row order. */
    public List<Object> column(String name) {
        if (!getColumnNames().contains(name)) {
            throw new IllegalArgumentException("Collection '" + collectionName + "' has no column " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    @Override
    public String toString() {
        return "CollectionResult{collection='" + collectionName + "', columns=" + getColumnNames() +
               ", rows=" + rows.size() + '}';
    }

    public static Builder builder(String collectionName, List<ResultColumn> columns) {
        return new Builder(collectionName, columns);
    }

    public static final class Builder {
        private final String                    collectionName;
        private final List<ResultColumn>        columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(String collectionName, List<ResultColumn> columns) {
            this.collectionName = collectionName;
            this.columns        = columns;
        }

        /** Adds a row already shaped to the declared columns. */
        public Builder row(Map<String, Object> row) {
            rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            return this;
        }

        public CollectionResult build() { return new CollectionResult(this); }
    }
}
