package com.episcope.trends.model;

/**
 * Freshness of a cache entry, always derived from its timestamps at read time.
 */
public enum EntryStatus {
    FRESH,
    STALE,
    EXPIRED
}
