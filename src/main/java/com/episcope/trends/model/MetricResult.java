package com.episcope.trends.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result for one metric kind in a batch: a normalized payload or an error marker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricResult {

    public static final String NO_CACHE_MESSAGE = "No cached data available";

    private JsonNode payload;
    private String error;
    private ResponseCacheStatus cacheStatus;
    private Instant lastUpdated;
    /**
     * Timeframe the payload belongs to; differs from the request when a fallback was used.
     */
    private String timeframe;

    public static MetricResult fresh(JsonNode payload, Instant fetchedAt, String timeframe) {
        return new MetricResult(payload, null, ResponseCacheStatus.FRESH, fetchedAt, timeframe);
    }

    public static MetricResult cached(CacheEntry entry, ResponseCacheStatus status) {
        return new MetricResult(entry.getPayload(), null, status, entry.getFetchedAt(), entry.getTimeframe());
    }

    public static MetricResult error(String error, ResponseCacheStatus status, String timeframe) {
        return new MetricResult(null, error, status, null, timeframe);
    }

    public boolean isError() {
        return payload == null;
    }

    /**
     * Value placed in the response slot for this kind: the payload, or {"error": ...}.
     */
    public JsonNode toSlot() {
        if (payload != null) {
            return payload;
        }
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", error != null ? error : NO_CACHE_MESSAGE);
        return node;
    }

    /**
     * Whether the payload carries data worth showing; fallbacks are tried otherwise.
     * Related kinds count only their top list, a rising list alone is not enough.
     */
    public boolean hasContent(MetricKind kind) {
        if (payload == null || payload.has("error")) {
            return false;
        }
        switch (kind) {
            case RELATED_QUERIES:
            case RELATED_TOPICS:
                return nonEmpty(payload.get("top_" + kind.getItemLabel()));
            case INTEREST_BY_REGION:
                return nonEmpty(payload.get("top_regions")) || nonEmpty(payload.get("regional_distribution"));
            default:
                return payload.path("data_points").asInt(0) > 0;
        }
    }

    private static boolean nonEmpty(JsonNode node) {
        return node != null && node.size() > 0;
    }
}
