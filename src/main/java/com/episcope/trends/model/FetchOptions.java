package com.episcope.trends.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call switches for the fetch orchestrator.
 */
@Value
@Builder(toBuilder = true)
public class FetchOptions {

    public static final FetchOptions DEFAULTS = FetchOptions.builder().build();

    /**
     * Retry empty related/regional kinds with a denser timeframe.
     */
    boolean fallbackEnabled;

    /**
     * Fetch regardless of freshness, retry ceiling or cool-down.
     */
    boolean forceRefresh;

    /**
     * Upper bound for the whole call; null means unbounded.
     */
    Duration timeout;
}
