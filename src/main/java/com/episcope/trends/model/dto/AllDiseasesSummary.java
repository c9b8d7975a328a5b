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
 * Summaries for every tracked entity, keyed by entity name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllDiseasesSummary {

    private String timeframe;

    @JsonProperty("timeframe_description")
    private String timeframeDescription;

    private String geo;

    @Builder.Default
    private Map<String, DiseaseSummary> diseases = new LinkedHashMap<>();

    @JsonProperty("total_diseases")
    private int totalDiseases;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("timeframe_converted")
    private Boolean timeframeConverted;

    @JsonProperty("conversion_note")
    private String conversionNote;
}
