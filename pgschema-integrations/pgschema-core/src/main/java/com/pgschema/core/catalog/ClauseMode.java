package com.pgschema.core.catalog;

/** How the first restriction predicate is attached to a query template. */
public enum ClauseMode {
    /** The template has no WHERE clause; the first predicate opens one. */
    WHERE,
    /** The template already ends in a WHERE clause; every predicate is joined with AND. */
    AND
}
