package com.episcope.trends.exception;

/**
 * Upstream body could not be parsed into a known payload shape.
 */
public class UpstreamMalformedResponseException extends TrendsException {

    public UpstreamMalformedResponseException(String message) {
        super(message);
    }

    public UpstreamMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
