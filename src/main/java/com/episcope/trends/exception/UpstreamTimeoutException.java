package com.episcope.trends.exception;

/**
 * Upstream call did not complete within the configured timeout.
 */
public class UpstreamTimeoutException extends UpstreamRequestException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
