package io.mnemo.core.vector;

import java.io.IOException;

public class VectorBackendException extends IOException {
    private final String collection;
    private final String operation;
    // -1 when the request never produced a response
    private final int statusCode;

    public VectorBackendException(String collection, String operation, String message) {
        this(collection, operation, -1, message, null);
    }

    public VectorBackendException(String collection, String operation, int statusCode, String message) {
        this(collection, operation, statusCode, message, null);
    }

    public VectorBackendException(String collection, String operation, String message, Throwable cause) {
        this(collection, operation, -1, message, cause);
    }

    public VectorBackendException(String collection, String operation, int statusCode, String message, Throwable cause) {
        super(operation + " on collection '" + collection + "' failed: " + message, cause);
        this.collection = collection;
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String collection() {
        return collection;
    }

    public String operation() {
        return operation;
    }

    public int statusCode() {
        return statusCode;
    }
}
