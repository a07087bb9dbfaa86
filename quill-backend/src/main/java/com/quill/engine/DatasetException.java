package com.quill.engine;

/**
 * Thrown when a dataset mutation (CSV load, upload, drop) fails.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
