package com.episcope.trends.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interest broken down by region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionalMetrics implements MetricPayload {

    @JsonProperty("top_regions")
    @Builder.Default
    private List<RegionInterest> topRegions = new ArrayList<>();

    @JsonProperty("regional_distribution")
    @Builder.Default
    private Map<String, Double> regionalDistribution = new LinkedHashMap<>();

    private String error;

    public static RegionalMetrics empty(String error) {
        return RegionalMetrics.builder().error(error).build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegionInterest {
        private String region;
        private double interest;

        /**
         * Original upstream code when the region name was resolved from a numeric code.
         */
        @JsonProperty("region_note")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String regionNote;
    }
}
