package com.episcope.trends.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined response for one batch. Every requested metric kind has a slot,
 * holding either its payload or an error marker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendsResponse {

    private String entity;

    /**
     * Timeframe actually used, after conversion.
     */
    private String timeframe;

    @JsonProperty("timeframe_description")
    private String timeframeDescription;

    private String geo;

    @JsonIgnore
    @Builder.Default
    private Map<MetricKind, MetricResult> metrics = new LinkedHashMap<>();

    @JsonProperty("cache_status")
    private ResponseCacheStatus cacheStatus;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("original_timeframe")
    private String originalTimeframe;

    @JsonProperty("timeframe_converted")
    private Boolean timeframeConverted;

    @JsonProperty("conversion_note")
    private String conversionNote;

    /**
     * Alternate timeframe used per kind, null when none was needed or it did not help.
     * Only present when the caller opted into fallback mode.
     */
    @JsonProperty("fallback_used")
    private Map<MetricKind, String> fallbackUsed;

    @JsonAnyGetter
    public Map<String, JsonNode> metricSlots() {
        Map<String, JsonNode> slots = new LinkedHashMap<>();
        metrics.forEach((kind, result) -> slots.put(kind.getWireName(), result.toSlot()));
        return slots;
    }

    public MetricResult getResult(MetricKind kind) {
        return metrics.get(kind);
    }

    public JsonNode getSlot(MetricKind kind) {
        MetricResult result = metrics.get(kind);
        return result != null ? result.toSlot() : null;
    }
}
