package com.ivamare.bulkload.exception;

/**
 * Base exception for all bulk load errors.
 */
public class BulkLoadException extends RuntimeException {

    public BulkLoadException(String message) {
        super(message);
    }

    public BulkLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
