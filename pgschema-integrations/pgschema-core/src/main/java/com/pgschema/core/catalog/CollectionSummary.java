package com.pgschema.core.catalog;

import java.util.List;

/** Name and restriction columns of a collection, as returned by collection listings. */
public final class CollectionSummary {

    private final String       name;
    private final List<String> restrictionColumns;

    CollectionSummary(String name, List<String> restrictionColumns) {
        this.name               = name;
        this.restrictionColumns = List.copyOf(restrictionColumns);
    }

    public String       getName()               { return name; }
    public List<String> getRestrictionColumns() { return restrictionColumns; }

    @Override
    public String toString() {
        return "CollectionSummary{name='" + name + "', restrictions=" + restrictionColumns + '}';
    }
}
