package com.episcope.trends.service.cache;

import com.episcope.trends.entity.CacheEntryEntity;
import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.repository.CacheEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Cache store backed by the trends_cache table.
 */
@Slf4j
public class JpaCacheStore implements CacheStore {

    private final CacheEntryRepository repository;
    private final FreshnessPolicy freshnessPolicy;

    public JpaCacheStore(CacheEntryRepository repository, FreshnessPolicy freshnessPolicy) {
        this.repository = repository;
        this.freshnessPolicy = freshnessPolicy;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CacheEntry> get(String key) {
        return repository.findById(key).map(JpaCacheStore::toModel);
    }

    @Override
    @Transactional
    public void put(CacheEntry entry) {
        repository.save(toEntity(entry));
    }

    @Override
    @Transactional
    public void touchAccess(String key, Instant now) {
        repository.touchAccess(key, now);
    }

    /**
     * Row is locked for the duration of the mutation so concurrent counter updates
     * are applied one after the other.
     */
    @Override
    @Transactional
    public Optional<CacheEntry> update(String key, UnaryOperator<CacheEntry> mutation) {
        Optional<CacheEntryEntity> current = repository.findForUpdate(key);
        CacheEntry updated = mutation.apply(current.map(JpaCacheStore::toModel).orElse(null));
        if (updated == null) {
            return current.map(JpaCacheStore::toModel);
        }
        CacheEntryEntity saved = repository.save(toEntity(updated));
        return Optional.of(toModel(saved));
    }

    @Override
    @Transactional
    public int delete(String entity, MetricKind metricKind) {
        int removed;
        if (entity != null && metricKind != null) {
            removed = repository.deleteByEntityAndMetricKind(entity, metricKind);
        } else if (entity != null) {
            removed = repository.deleteByEntity(entity);
        } else if (metricKind != null) {
            removed = repository.deleteByMetricKind(metricKind);
        } else {
            removed = (int) repository.count();
            repository.deleteAllInBatch();
        }
        log.debug("Removed {} cache rows (entity={}, metricKind={})", removed, entity, metricKind);
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CacheEntry> findAll() {
        return repository.findAll().stream().map(JpaCacheStore::toModel).toList();
    }

    @Override
    public EntryStatus deriveStatus(CacheEntry entry, Instant now) {
        return freshnessPolicy.deriveStatus(entry, now);
    }

    static CacheEntry toModel(CacheEntryEntity entity) {
        return CacheEntry.builder()
                .key(entity.getCacheKey())
                .entity(entity.getEntity())
                .metricKind(entity.getMetricKind())
                .timeframe(entity.getTimeframe())
                .geo(entity.getGeo())
                .payload(entity.getPayload())
                .fetchedAt(entity.getFetchedAt())
                .expiresAt(entity.getExpiresAt())
                .lastAccessedAt(entity.getLastAccessedAt())
                .fetchCount(entity.getFetchCount())
                .retryCount(entity.getRetryCount())
                .lastError(entity.getLastError())
                .lastErrorKind(entity.getLastErrorKind())
                .lastFailedAt(entity.getLastFailedAt())
                .build();
    }

    static CacheEntryEntity toEntity(CacheEntry entry) {
        return CacheEntryEntity.builder()
                .cacheKey(entry.getKey())
                .entity(entry.getEntity())
                .metricKind(entry.getMetricKind())
                .timeframe(entry.getTimeframe())
                .geo(entry.getGeo() != null ? entry.getGeo() : "")
                .payload(entry.getPayload())
                .fetchedAt(entry.getFetchedAt())
                .expiresAt(entry.getExpiresAt())
                .lastAccessedAt(entry.getLastAccessedAt())
                .fetchCount(entry.getFetchCount())
                .retryCount(entry.getRetryCount())
                .lastError(entry.getLastError())
                .lastErrorKind(entry.getLastErrorKind())
                .lastFailedAt(entry.getLastFailedAt())
                .build();
    }
}
