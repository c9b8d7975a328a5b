package com.episcope.trends.model;

/**
 * Failure categories recorded on cache entries.
 */
public enum FetchErrorKind {
    RATE_LIMITED,
    UPSTREAM_UNAVAILABLE,
    UPSTREAM_ERROR,
    TIMEOUT
}
