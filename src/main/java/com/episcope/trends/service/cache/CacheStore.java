package com.episcope.trends.service.cache;

import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import com.episcope.trends.model.MetricKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistent key to entry mapping with freshness metadata.
 * Knows nothing about the upstream protocol.
 */
public interface CacheStore {

    Optional<CacheEntry> get(String key);

    /**
     * Upsert keyed by {@code entry.getKey()}.
     */
    void put(CacheEntry entry);

    /**
     * Update last access time without affecting freshness.
     */
    void touchAccess(String key, Instant now);

    /**
     * Atomic read-modify-write of one entry. The mutation receives the entry as it
     * is at write time (null when absent) and returns the entry to store, or null to
     * leave the store unchanged.
     *
     * @return the entry as stored after the call, empty when absent
     */
    Optional<CacheEntry> update(String key, UnaryOperator<CacheEntry> mutation);

    /**
     * Delete entries matching the filter; null filter fields match everything.
     *
     * @return number of entries removed
     */
    int delete(String entity, MetricKind metricKind);

    List<CacheEntry> findAll();

    EntryStatus deriveStatus(CacheEntry entry, Instant now);
}
