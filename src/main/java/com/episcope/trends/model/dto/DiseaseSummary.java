package com.episcope.trends.model.dto;

import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.ResponseCacheStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Flattened view of all four metric kinds for one entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiseaseSummary {

    public static final String DATA_SOURCE = "google_trends";

    @JsonProperty("disease_name")
    private String diseaseName;

    private String timeframe;

    @JsonProperty("timeframe_description")
    private String timeframeDescription;

    private String geo;

    @JsonProperty("current_interest")
    private Double currentInterest;

    @JsonProperty("trend_direction")
    private String trendDirection;

    @JsonProperty("trend_strength")
    private Double trendStrength;

    @JsonProperty("total_searches")
    private Long totalSearches;

    @JsonProperty("peak_interest")
    private Double peakInterest;

    @JsonProperty("average_interest")
    private Double averageInterest;

    @JsonProperty("top_related_queries")
    private JsonNode topRelatedQueries;

    @JsonProperty("top_related_topics")
    private JsonNode topRelatedTopics;

    @JsonProperty("top_regions")
    private JsonNode topRegions;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("cache_status")
    private ResponseCacheStatus cacheStatus;

    @JsonProperty("data_source")
    private String dataSource;

    @JsonProperty("original_timeframe")
    private String originalTimeframe;

    @JsonProperty("timeframe_converted")
    private Boolean timeframeConverted;

    @JsonProperty("conversion_note")
    private String conversionNote;

    @JsonProperty("fallback_used")
    private Map<MetricKind, String> fallbackUsed;

    private String error;

    public static DiseaseSummary failed(String diseaseName, String error) {
        return DiseaseSummary.builder()
                .diseaseName(diseaseName)
                .error(error)
                .build();
    }

    public boolean isFailed() {
        return error != null;
    }
}
