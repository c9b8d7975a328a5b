package com.episcope.trends.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the data in a response came from.
 */
public enum ResponseCacheStatus {

    FRESH("fresh"),             // Fetched now, or cached and still fresh
    STALE_CACHED("stale_cached"),
    NO_CACHE("no_cache"),       // Nothing cached and no fetch attempted
    ERROR("error");             // Fetch failed and nothing cached

    private final String wireName;

    ResponseCacheStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * The worse of two statuses, used to summarize a batch.
     */
    public ResponseCacheStatus worst(ResponseCacheStatus other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
