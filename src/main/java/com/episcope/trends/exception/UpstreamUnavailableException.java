package com.episcope.trends.exception;

/**
 * Upstream client is disabled or not initialized. Fatal for the call, never retried.
 */
public class UpstreamUnavailableException extends TrendsException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
