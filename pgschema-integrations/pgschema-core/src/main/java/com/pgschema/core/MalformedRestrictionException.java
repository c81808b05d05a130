package com.pgschema.core;

/**
 * Thrown when a restriction set does not fit the collection it targets.
 * Only raised when the engine runs in
 * {@link com.pgschema.core.query.RestrictionMode#STRICT} mode.
 */
public class MalformedRestrictionException extends SchemaQueryException {

    public MalformedRestrictionException(String message) { super(message); }
}
