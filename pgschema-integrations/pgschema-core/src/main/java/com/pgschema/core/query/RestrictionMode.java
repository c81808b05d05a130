package com.pgschema.core.query;

/** How strictly a restriction set is checked against its collection. */
public enum RestrictionMode {
    /** Extra positions beyond the restriction columns are ignored. */
    PERMISSIVE,
    /**
     * A set with more positions than the collection has restriction columns is
     * rejected. Shorter sets are still accepted.
     */
    STRICT
}
