package com.episcope.trends.model.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary statistics of an interest-over-time series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterestOverTimeMetrics implements MetricPayload {

    @JsonProperty("current_interest")
    private double currentInterest;

    @JsonProperty("peak_interest")
    private double peakInterest;

    @JsonProperty("average_interest")
    private double averageInterest;

    @JsonProperty("trend_direction")
    private TrendDirection trendDirection;

    /**
     * Relative change between the earliest and latest points, in [0, 1].
     */
    @JsonProperty("trend_strength")
    private double trendStrength;

    /**
     * Rough estimate derived from the average interest.
     */
    @JsonProperty("total_searches")
    private long totalSearches;

    @JsonProperty("data_points")
    private int dataPoints;

    private String error;

    public static InterestOverTimeMetrics empty(String error) {
        return InterestOverTimeMetrics.builder()
                .trendDirection(TrendDirection.STABLE)
                .error(error)
                .build();
    }
}
