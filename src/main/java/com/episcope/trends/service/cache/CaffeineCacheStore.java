package com.episcope.trends.service.cache;

import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import com.episcope.trends.model.MetricKind;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * In-memory cache store on top of a Caffeine cache. Entries are only evicted by size,
 * never by age, so expired payloads stay available as a stale fallback.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, CacheEntry> cache;
    private final FreshnessPolicy freshnessPolicy;

    public CaffeineCacheStore(Cache<String, CacheEntry> cache, FreshnessPolicy freshnessPolicy) {
        this.cache = cache;
        this.freshnessPolicy = freshnessPolicy;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(entry -> entry.toBuilder().build());
    }

    @Override
    public void put(CacheEntry entry) {
        cache.put(entry.getKey(), entry.toBuilder().build());
    }

    @Override
    public void touchAccess(String key, Instant now) {
        cache.asMap().computeIfPresent(key, (k, entry) -> entry.toBuilder().lastAccessedAt(now).build());
    }

    @Override
    public Optional<CacheEntry> update(String key, UnaryOperator<CacheEntry> mutation) {
        CacheEntry stored = cache.asMap().compute(key, (k, current) -> {
            CacheEntry updated = mutation.apply(current == null ? null : current.toBuilder().build());
            return updated != null ? updated : current;
        });
        return Optional.ofNullable(stored).map(entry -> entry.toBuilder().build());
    }

    @Override
    public int delete(String entity, MetricKind metricKind) {
        AtomicInteger removed = new AtomicInteger();
        cache.asMap().entrySet().removeIf(e -> {
            CacheEntry entry = e.getValue();
            boolean matches = (entity == null || entity.equals(entry.getEntity()))
                    && (metricKind == null || metricKind == entry.getMetricKind());
            if (matches) {
                removed.incrementAndGet();
            }
            return matches;
        });
        log.debug("Removed {} in-memory entries (entity={}, metricKind={})", removed.get(), entity, metricKind);
        return removed.get();
    }

    @Override
    public List<CacheEntry> findAll() {
        return new ArrayList<>(cache.asMap().values());
    }

    @Override
    public EntryStatus deriveStatus(CacheEntry entry, Instant now) {
        return freshnessPolicy.deriveStatus(entry, now);
    }
}
