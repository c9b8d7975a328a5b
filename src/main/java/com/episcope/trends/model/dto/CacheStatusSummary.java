package com.episcope.trends.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache freshness counts, overall and per tracked entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatusSummary {

    @JsonProperty("total_entries")
    private long totalEntries;

    @JsonProperty("fresh_entries")
    private long freshEntries;

    @JsonProperty("stale_entries")
    private long staleEntries;

    @JsonProperty("expired_entries")
    private long expiredEntries;

    @JsonProperty("entity_stats")
    @Builder.Default
    private Map<String, StatusCounts> entityStats = new LinkedHashMap<>();

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusCounts {
        private long total;
        private long fresh;
        private long stale;
        private long expired;
    }
}
