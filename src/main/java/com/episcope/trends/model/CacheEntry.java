package com.episcope.trends.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One cached normalized payload per (entity, metric kind, timeframe, geo).
 * Freshness is not stored here; it is derived from {@link #expiresAt} by the cache store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String key;

    private String entity;

    private MetricKind metricKind;

    private String timeframe;

    /**
     * Region code, empty for global.
     */
    private String geo;

    /**
     * Normalized payload produced by the data processor.
     */
    private JsonNode payload;

    private Instant fetchedAt;

    private Instant expiresAt;

    private Instant lastAccessedAt;

    /**
     * Successful upstream fetches that populated this entry.
     */
    private int fetchCount;

    /**
     * Consecutive failed attempts since the last success.
     */
    private int retryCount;

    private String lastError;

    private FetchErrorKind lastErrorKind;

    private Instant lastFailedAt;

    public boolean hasPayload() {
        return payload != null && !payload.isNull();
    }

    /**
     * Apply a successful fetch: new payload and expiry, counters updated.
     */
    public CacheEntry withSuccess(JsonNode newPayload, Instant now, Instant newExpiresAt) {
        return toBuilder()
                .payload(newPayload)
                .fetchedAt(now)
                .expiresAt(newExpiresAt)
                .fetchCount(fetchCount + 1)
                .retryCount(0)
                .lastError(null)
                .lastErrorKind(null)
                .lastFailedAt(null)
                .build();
    }

    /**
     * Apply a failed fetch; the payload is left untouched.
     */
    public CacheEntry withFailure(String error, FetchErrorKind kind, Instant now) {
        return toBuilder()
                .retryCount(retryCount + 1)
                .lastError(error)
                .lastErrorKind(kind)
                .lastFailedAt(now)
                .build();
    }
}
