package com.episcope.trends.exception;

/**
 * Base class for all trends cache failures.
 */
public class TrendsException extends RuntimeException {

    public TrendsException(String message) {
        super(message);
    }

    public TrendsException(String message, Throwable cause) {
        super(message, cause);
    }
}
