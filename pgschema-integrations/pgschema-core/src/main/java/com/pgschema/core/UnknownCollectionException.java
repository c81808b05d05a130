package com.pgschema.core;

/** Thrown when a collection name has no registered descriptor. Not retryable. */
public class UnknownCollectionException extends SchemaQueryException {

    private final String collectionName;

    public UnknownCollectionException(String collectionName) {
        super("Unknown metadata collection: " + collectionName);
        this.collectionName = collectionName;
    }

    public String getCollectionName() { return collectionName; }
}
