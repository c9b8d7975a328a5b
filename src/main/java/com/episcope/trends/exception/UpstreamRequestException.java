package com.episcope.trends.exception;

/**
 * Upstream call failed for a reason other than rate limiting.
 */
public class UpstreamRequestException extends TrendsException {

    public UpstreamRequestException(String message) {
        super(message);
    }

    public UpstreamRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
