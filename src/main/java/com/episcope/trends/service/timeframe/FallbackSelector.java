package com.episcope.trends.service.timeframe;

import com.episcope.trends.model.MetricKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Timeframes that empirically yield denser data per metric kind. Related queries and
 * topics are sparse over a week, regional interest is sparse under half a year.
 */
@Component
public class FallbackSelector {

    private static final String DEFAULT_FALLBACK = "today 3-m";

    private static final Map<MetricKind, String> FALLBACKS = new EnumMap<>(Map.of(
            MetricKind.INTEREST_OVER_TIME, "now 7-d",
            MetricKind.RELATED_QUERIES, "today 3-m",
            MetricKind.RELATED_TOPICS, "today 3-m",
            MetricKind.INTEREST_BY_REGION, "today 6-m"
    ));

    public String alternateTimeframe(MetricKind kind) {
        return FALLBACKS.getOrDefault(kind, DEFAULT_FALLBACK);
    }
}
