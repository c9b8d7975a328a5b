package com.episcope.trends.exception;

/**
 * Timeframe token that cannot be converted to a valid one.
 */
public class InvalidTimeframeException extends TrendsException {

    public InvalidTimeframeException(String message) {
        super(message);
    }
}
