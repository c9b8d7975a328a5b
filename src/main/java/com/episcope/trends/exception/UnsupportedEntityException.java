package com.episcope.trends.exception;

/**
 * Entity outside the tracked set.
 */
public class UnsupportedEntityException extends TrendsException {

    public UnsupportedEntityException(String message) {
        super(message);
    }
}
