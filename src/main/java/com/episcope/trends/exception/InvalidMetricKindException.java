package com.episcope.trends.exception;

public class InvalidMetricKindException extends TrendsException {

    public InvalidMetricKindException(String message) {
        super(message);
    }
}
