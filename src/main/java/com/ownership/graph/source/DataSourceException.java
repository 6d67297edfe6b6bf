package com.ownership.graph.source;

/**
 * Runtime exception thrown when an external lookup fails: transport error,
 * non-success status, or a response that cannot be parsed.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
