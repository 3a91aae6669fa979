package com.testinsight.exception;

/**
 * Raised when a refresh could not be committed. The previously cached snapshot stays authoritative.
 */
public class AggregationFailedException extends RuntimeException {

    public AggregationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
