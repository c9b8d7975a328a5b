package com.episcope.trends.service;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.model.FetchOptions;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.MetricResult;
import com.episcope.trends.model.ResolvedTimeframe;
import com.episcope.trends.model.TrendsResponse;
import com.episcope.trends.model.dto.AllDiseasesSummary;
import com.episcope.trends.model.dto.DiseaseSummary;
import com.episcope.trends.service.timeframe.TimeframeNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

/**
 * Per-disease summaries built from one batch over all metric kinds.
 */
@Slf4j
@Service
public class TrendsSummaryService {

    private static final List<MetricKind> ALL_KINDS = List.copyOf(EnumSet.allOf(MetricKind.class));

    private final FetchOrchestrator orchestrator;
    private final TimeframeNormalizer timeframeNormalizer;
    private final TrendsProperties properties;
    private final Clock clock;

    public TrendsSummaryService(
            FetchOrchestrator orchestrator,
            TimeframeNormalizer timeframeNormalizer,
            TrendsProperties properties,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.timeframeNormalizer = timeframeNormalizer;
        this.properties = properties;
        this.clock = clock;
    }

    public DiseaseSummary getDiseaseSummary(String entity, String timeframe, String geo, boolean fallback) {
        TrendsResponse response = orchestrator.getMetrics(entity, ALL_KINDS, timeframe, geo,
                FetchOptions.builder().fallbackEnabled(fallback).build());

        MetricResult interest = response.getResult(MetricKind.INTEREST_OVER_TIME);
        if (interest == null || interest.isError()) {
            return DiseaseSummary.failed(response.getEntity(), "No interest data available");
        }
        JsonNode interestData = interest.getPayload();

        return DiseaseSummary.builder()
                .diseaseName(response.getEntity())
                .timeframe(response.getTimeframe())
                .timeframeDescription(response.getTimeframeDescription())
                .geo(response.getGeo())
                .currentInterest(interestData.path("current_interest").asDouble(0))
                .trendDirection(interestData.path("trend_direction").asText("stable"))
                .trendStrength(interestData.path("trend_strength").asDouble(0))
                .totalSearches(interestData.path("total_searches").asLong(0))
                .peakInterest(interestData.path("peak_interest").asDouble(0))
                .averageInterest(interestData.path("average_interest").asDouble(0))
                .topRelatedQueries(arrayField(response, MetricKind.RELATED_QUERIES, "top_queries"))
                .topRelatedTopics(arrayField(response, MetricKind.RELATED_TOPICS, "top_topics"))
                .topRegions(arrayField(response, MetricKind.INTEREST_BY_REGION, "top_regions"))
                .lastUpdated(response.getLastUpdated())
                .cacheStatus(response.getCacheStatus())
                .dataSource(DiseaseSummary.DATA_SOURCE)
                .originalTimeframe(response.getOriginalTimeframe())
                .timeframeConverted(response.getTimeframeConverted())
                .conversionNote(response.getConversionNote())
                .fallbackUsed(response.getFallbackUsed())
                .build();
    }

    private static JsonNode arrayField(TrendsResponse response, MetricKind kind, String field) {
        JsonNode value = response.getSlot(kind).path(field);
        return value.isArray() ? value : JsonNodeFactory.instance.arrayNode();
    }

    /**
     * Summaries for every tracked entity. A failing entity is reported in its slot
     * and does not affect the others.
     */
    public AllDiseasesSummary getAllDiseasesSummary(String timeframe, String geo, boolean fallback) {
        ResolvedTimeframe resolved = timeframeNormalizer.resolve(timeframe);
        String safeGeo = geo != null ? geo : properties.getDefaultGeo();

        AllDiseasesSummary summary = AllDiseasesSummary.builder()
                .timeframe(resolved.getToken())
                .timeframeDescription(resolved.getDescription())
                .geo(safeGeo)
                .totalDiseases(properties.getEntities().size())
                .build();

        for (String entity : properties.getEntities()) {
            try {
                summary.getDiseases().put(entity, getDiseaseSummary(entity, timeframe, safeGeo, fallback));
            } catch (RuntimeException e) {
                log.error("Failed to build summary for {}", entity, e);
                summary.getDiseases().put(entity, DiseaseSummary.failed(entity, e.getMessage()));
            }
        }

        if (resolved.isConverted()) {
            summary.setTimeframeConverted(true);
            summary.setConversionNote("Some timeframes were automatically converted for better data quality");
        }
        summary.setLastUpdated(clock.instant());
        return summary;
    }
}
