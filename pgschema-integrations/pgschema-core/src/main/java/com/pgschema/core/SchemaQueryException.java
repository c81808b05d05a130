package com.pgschema.core;

/**
 * Base class of every failure raised while resolving or fetching a metadata
 * collection. Subclasses distinguish caller errors from store failures.
 */
public class SchemaQueryException extends Exception {

    public SchemaQueryException(String message)                  { super(message); }
    public SchemaQueryException(String message, Throwable cause) { super(message, cause); }
}
