package com.episcope.trends.service;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;
import com.episcope.trends.model.dto.CacheStatusSummary;
import com.episcope.trends.model.dto.ClearCacheResult;
import com.episcope.trends.service.cache.CacheStore;
import com.episcope.trends.service.log.RequestLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Admin service for cache maintenance and upstream call statistics.
 */
@Slf4j
@Service
public class TrendsAdminService {

    private final CacheStore cacheStore;
    private final RequestLog requestLog;
    private final TrendsProperties properties;
    private final Clock clock;

    public TrendsAdminService(CacheStore cacheStore, RequestLog requestLog, TrendsProperties properties, Clock clock) {
        this.cacheStore = cacheStore;
        this.requestLog = requestLog;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Delete cache entries; null arguments match everything.
     */
    public ClearCacheResult clearCache(String entity, MetricKind metricKind) {
        String canonicalEntity = canonicalEntity(entity);
        try {
            int deleted = cacheStore.delete(canonicalEntity, metricKind);
            String message;
            if (canonicalEntity != null && metricKind != null) {
                message = "Cleared " + deleted + " cache entries for " + canonicalEntity + " - " + metricKind.getWireName();
            } else if (canonicalEntity != null) {
                message = "Cleared " + deleted + " cache entries for " + canonicalEntity;
            } else if (metricKind != null) {
                message = "Cleared " + deleted + " cache entries for " + metricKind.getWireName();
            } else {
                message = "Cleared all " + deleted + " cache entries";
            }

            log.info("Cache cleared: {}", message);
            return ClearCacheResult.builder()
                    .success(true)
                    .message(message)
                    .deletedCount(deleted)
                    .build();

        } catch (RuntimeException e) {
            log.error("Failed to clear cache: entity={}, kind={}", canonicalEntity, metricKind, e);
            return ClearCacheResult.builder()
                    .success(false)
                    .error("Failed to clear cache: " + e.getMessage())
                    .build();
        }
    }

    public ClearCacheResult clearAllCache() {
        return clearCache(null, null);
    }

    /**
     * Fresh / stale / expired counts, overall and for every tracked entity.
     */
    public CacheStatusSummary cacheStatusSummary() {
        Instant now = clock.instant();
        CacheStatusSummary summary = CacheStatusSummary.builder().lastUpdated(now).build();
        for (String entity : properties.getEntities()) {
            summary.getEntityStats().put(entity, new CacheStatusSummary.StatusCounts());
        }

        List<CacheEntry> entries = cacheStore.findAll();
        for (CacheEntry entry : entries) {
            EntryStatus status = cacheStore.deriveStatus(entry, now);
            summary.setTotalEntries(summary.getTotalEntries() + 1);
            switch (status) {
                case FRESH:
                    summary.setFreshEntries(summary.getFreshEntries() + 1);
                    break;
                case STALE:
                    summary.setStaleEntries(summary.getStaleEntries() + 1);
                    break;
                default:
                    summary.setExpiredEntries(summary.getExpiredEntries() + 1);
            }

            CacheStatusSummary.StatusCounts counts = summary.getEntityStats().get(entry.getEntity());
            if (counts != null) {
                count(counts, status);
            }
        }

        log.debug("Cache status: total={}, fresh={}, stale={}, expired={}", summary.getTotalEntries(),
                summary.getFreshEntries(), summary.getStaleEntries(), summary.getExpiredEntries());
        return summary;
    }

    public List<RequestLogEntry> recentRequests(int limit) {
        return requestLog.recent(Math.max(0, limit));
    }

    /**
     * Upstream attempts per status within the trailing window.
     */
    public Map<RequestStatus, Long> requestCounts(Duration window) {
        return requestLog.countsSince(clock.instant().minus(window));
    }

    private static void count(CacheStatusSummary.StatusCounts counts, EntryStatus status) {
        counts.setTotal(counts.getTotal() + 1);
        switch (status) {
            case FRESH:
                counts.setFresh(counts.getFresh() + 1);
                break;
            case STALE:
                counts.setStale(counts.getStale() + 1);
                break;
            default:
                counts.setExpired(counts.getExpired() + 1);
        }
    }

    private String canonicalEntity(String entity) {
        if (entity == null || entity.isBlank()) {
            return null;
        }
        for (String supported : properties.getEntities()) {
            if (supported.equalsIgnoreCase(entity.trim())) {
                return supported;
            }
        }
        return entity.trim();
    }
}
