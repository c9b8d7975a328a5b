package com.episcope.trends.entity;

import com.episcope.trends.model.FetchErrorKind;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.repository.converter.JsonNodeConverter;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the trends_cache table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "trends_cache", indexes = {
        @Index(name = "idx_trends_cache_entity_kind", columnList = "entity, metric_kind"),
        @Index(name = "idx_trends_cache_expires", columnList = "expires_at")
})
public class CacheEntryEntity {

    @Id
    @Column(name = "cache_key", nullable = false, length = 64)
    private String cacheKey;

    @Column(name = "entity", nullable = false, length = 128)
    private String entity;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_kind", nullable = false, length = 32)
    private MetricKind metricKind;

    @Column(name = "timeframe", nullable = false, length = 64)
    private String timeframe;

    @Column(name = "geo", nullable = false, length = 16)
    private String geo;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT")
    private JsonNode payload;

    @Column(name = "fetched_at")
    private Instant fetchedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "fetch_count", nullable = false)
    private int fetchCount;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_kind", length = 32)
    private FetchErrorKind lastErrorKind;

    @Column(name = "last_failed_at")
    private Instant lastFailedAt;

    @PrePersist
    protected void onCreate() {
        if (geo == null) {
            geo = "";
        }
    }
}
