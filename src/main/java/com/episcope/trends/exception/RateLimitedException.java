package com.episcope.trends.exception;

import java.time.Duration;

/**
 * Upstream rejected the call with a rate-limit response. Retryable after a backoff.
 */
public class RateLimitedException extends UpstreamRequestException {

    private final Duration retryAfter;

    public RateLimitedException(String message) {
        this(message, null, null);
    }

    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Retry-After hint sent by the upstream, null when absent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
