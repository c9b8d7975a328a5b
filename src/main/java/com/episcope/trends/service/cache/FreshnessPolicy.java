package com.episcope.trends.service.cache;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * TTL and stale-margin rules for cache entries.
 *
 * With margin = staleMargin * (expiresAt - fetchedAt):
 * fresh before expiresAt - margin, stale until expiresAt, expired from expiresAt on.
 */
@Component
public class FreshnessPolicy {

    private final Duration ttl;
    private final double staleMargin;

    @Autowired
    public FreshnessPolicy(TrendsProperties properties) {
        this(properties.getCache().getTtl(), properties.getCache().getStaleMargin());
    }

    public FreshnessPolicy(Duration ttl, double staleMargin) {
        if (staleMargin < 0 || staleMargin > 1) {
            throw new IllegalArgumentException("Stale margin must be within [0, 1]: " + staleMargin);
        }
        this.ttl = ttl;
        this.staleMargin = staleMargin;
    }

    public Instant expiryFor(Instant fetchedAt) {
        return fetchedAt.plus(ttl);
    }

    public EntryStatus deriveStatus(CacheEntry entry, Instant now) {
        Instant expiresAt = entry.getExpiresAt();
        if (expiresAt == null || !now.isBefore(expiresAt)) {
            return EntryStatus.EXPIRED;
        }

        Duration lifetime = entry.getFetchedAt() != null
                ? Duration.between(entry.getFetchedAt(), expiresAt)
                : ttl;
        long marginMillis = (long) (lifetime.toMillis() * staleMargin);
        Instant staleFrom = expiresAt.minusMillis(marginMillis);

        return now.isBefore(staleFrom) ? EntryStatus.FRESH : EntryStatus.STALE;
    }

    public Duration getTtl() {
        return ttl;
    }
}
