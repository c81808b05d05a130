package com.pgschema.core;

/**
 * Wraps a failure of the statement executor (connectivity, syntax, permission)
 * or rows it returned that do not fit the declared schema. The original
 * failure is kept as the cause; retrying is left to the caller.
 */
public class ExecutionFailedException extends SchemaQueryException {

    public ExecutionFailedException(String message, Throwable cause) { super(message, cause); }
}
