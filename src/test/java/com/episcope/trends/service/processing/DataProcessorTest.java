package com.episcope.trends.service.processing;

import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.payload.InterestOverTimeMetrics;
import com.episcope.trends.model.payload.RegionalMetrics;
import com.episcope.trends.model.payload.RelatedMetrics;
import com.episcope.trends.model.payload.TrendDirection;
import com.episcope.trends.upstream.UpstreamPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DataProcessor.
 */
class DataProcessorTest {

    private DataProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DataProcessor(new RegionNameResolver());
    }

    private static UpstreamPayload series(String entity, double... values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", String.format("2024-01-%02d", i + 1));
            row.put("time", String.valueOf(1704067200L + i * 86400L));
            row.put(entity, values[i]);
            rows.add(row);
        }
        return UpstreamPayload.table(List.of("date", "time", entity), rows);
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    // ------------------------------------------------------------------
    // Interest over time
    // ------------------------------------------------------------------

    @Test
    void testRisingSeries() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                series("Malaria", 10, 10, 10, 20, 20, 20), "Malaria");

        assertEquals(20.0, metrics.getCurrentInterest());
        assertEquals(20.0, metrics.getPeakInterest());
        assertEquals(15.0, metrics.getAverageInterest());
        assertEquals(TrendDirection.RISING, metrics.getTrendDirection());
        assertEquals(1.0, metrics.getTrendStrength());
        assertEquals(150000, metrics.getTotalSearches());
        assertEquals(6, metrics.getDataPoints());
        assertNull(metrics.getError());
    }

    @Test
    void testFallingSeriesStrength() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                series("Malaria", 40, 40, 40, 30, 30, 30), "Malaria");

        assertEquals(TrendDirection.FALLING, metrics.getTrendDirection());
        assertEquals(0.25, metrics.getTrendStrength());
    }

    @Test
    void testStableWithinTenPercent() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                series("Malaria", 50, 52, 51, 53, 54, 52), "Malaria");

        assertEquals(TrendDirection.STABLE, metrics.getTrendDirection());
        assertEquals(0.0, metrics.getTrendStrength());
    }

    @Test
    void testZeroBaselineGivesZeroStrength() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(series("Malaria", 0, 0, 0, 5, 5, 5), "Malaria");

        assertEquals(TrendDirection.RISING, metrics.getTrendDirection());
        assertEquals(0.0, metrics.getTrendStrength());
    }

    @Test
    void testSinglePointIsStable() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(series("Malaria", 42), "Malaria");

        assertEquals(42.0, metrics.getCurrentInterest());
        assertEquals(TrendDirection.STABLE, metrics.getTrendDirection());
        assertEquals(1, metrics.getDataPoints());
    }

    @Test
    void testRowsAreOrderedByTime() {
        List<Map<String, Object>> rows = List.of(
                row("time", "300", "Cholera", 9),
                row("time", "100", "Cholera", 1),
                row("time", "200", "Cholera", 5));
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                UpstreamPayload.table(List.of("time", "Cholera"), rows), "Cholera");

        assertEquals(9.0, metrics.getCurrentInterest());
        assertEquals(9.0, metrics.getPeakInterest());
        assertEquals(3, metrics.getDataPoints());
    }

    @Test
    void testEntityColumnMatchedCaseInsensitively() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(series("malaria", 1, 2), "Malaria");

        assertEquals(2, metrics.getDataPoints());
    }

    @Test
    void testEmptyPayloadGivesEmptyRecord() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(UpstreamPayload.empty(), "Malaria");

        assertEquals(0, metrics.getDataPoints());
        assertEquals(TrendDirection.STABLE, metrics.getTrendDirection());
    }

    @Test
    void testMissingValueColumnGivesEmptyRecord() {
        UpstreamPayload table = UpstreamPayload.table(List.of("date", "other"), List.of(row("date", "2024-01-01", "other", 3)));

        InterestOverTimeMetrics metrics = processor.processInterestOverTime(table, "Malaria");

        assertEquals(0, metrics.getDataPoints());
    }

    @Test
    void testWrongValueTypesAreSkipped() {
        List<Map<String, Object>> rows = List.of(
                row("date", "2024-01-01", "Malaria", "n/a"),
                row("date", "2024-01-02", "Malaria", true),
                row("date", "2024-01-03", "Malaria", "7"),
                row("date", "2024-01-04", "Malaria", 9));
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                UpstreamPayload.table(List.of("date", "Malaria"), rows), "Malaria");

        assertEquals(2, metrics.getDataPoints());
        assertEquals(9.0, metrics.getCurrentInterest());
    }

    @Test
    void testFlatListOfNumbers() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                UpstreamPayload.flatList(List.<Object>of(1, 2, "x", 3)), "Malaria");

        assertEquals(3, metrics.getDataPoints());
        assertEquals(3.0, metrics.getCurrentInterest());
    }

    @Test
    void testFlatListOfRows() {
        InterestOverTimeMetrics metrics = processor.processInterestOverTime(
                UpstreamPayload.flatList(List.<Object>of(
                        row("date", "2024-01-01", "Malaria", 40),
                        row("date", "2024-01-02", "Malaria", 55),
                        7)), "Malaria");

        assertEquals(3, metrics.getDataPoints());
        assertEquals(55.0, metrics.getPeakInterest());
    }

    // ------------------------------------------------------------------
    // Related
    // ------------------------------------------------------------------

    @Test
    void testKeyedBlockWithTopAndRising() {
        Map<String, UpstreamPayload> sections = new LinkedHashMap<>();
        sections.put("top", UpstreamPayload.table(List.of("query", "value"),
                List.of(row("query", "malaria symptoms", "value", 100), row("query", "malaria drugs", "value", 40))));
        sections.put("rising", UpstreamPayload.table(List.of("query", "value"),
                List.of(row("query", "malaria vaccine", "value", 250))));
        Map<String, Map<String, UpstreamPayload>> blocks = new LinkedHashMap<>();
        blocks.put("malaria", sections);

        RelatedMetrics metrics = processor.processRelated(UpstreamPayload.keyedBlock(blocks), "Malaria", MetricKind.RELATED_QUERIES);

        assertEquals(2, metrics.getTop().size());
        assertEquals(1, metrics.getRising().size());
        assertEquals("malaria symptoms", metrics.getTop().get(0).get("query"));
        Map<String, Object> json = metrics.toJson();
        assertEquals(2, json.get("total_top"));
        assertEquals(1, json.get("total_rising"));
        assertTrue(json.containsKey("top_queries"));
        assertTrue(json.containsKey("rising_queries"));
    }

    @Test
    void testAlternativeSectionUsedWhenTopAndRisingEmpty() {
        Map<String, UpstreamPayload> sections = new LinkedHashMap<>();
        sections.put("top", UpstreamPayload.table(List.of("topic_title"), List.of()));
        sections.put("rising", UpstreamPayload.empty());
        sections.put("other", UpstreamPayload.table(List.of("topic_title"), List.of(row("topic_title", "Fever"))));
        Map<String, Map<String, UpstreamPayload>> blocks = new LinkedHashMap<>();
        blocks.put("Cholera", sections);

        RelatedMetrics metrics = processor.processRelated(UpstreamPayload.keyedBlock(blocks), "Cholera", MetricKind.RELATED_TOPICS);

        assertEquals(1, metrics.getTop().size());
        assertEquals("Fever", metrics.getTop().get(0).get("topic_title"));
        assertTrue(metrics.toJson().containsKey("top_topics"));
    }

    @Test
    void testKeyedBlockWithoutEntityIsEmpty() {
        Map<String, Map<String, UpstreamPayload>> blocks = new LinkedHashMap<>();
        blocks.put("Diabetes", Map.of());

        RelatedMetrics metrics = processor.processRelated(UpstreamPayload.keyedBlock(blocks), "Cholera", MetricKind.RELATED_QUERIES);

        assertTrue(metrics.isEmpty());
    }

    @Test
    void testTableAndListGoToTop() {
        RelatedMetrics fromTable = processor.processRelated(
                UpstreamPayload.table(List.of("query"), List.of(row("query", "a"))), "Malaria", MetricKind.RELATED_QUERIES);
        RelatedMetrics fromList = processor.processRelated(
                UpstreamPayload.flatList(List.<Object>of("b", row("query", "c"))), "Malaria", MetricKind.RELATED_QUERIES);

        assertEquals(1, fromTable.getTop().size());
        assertTrue(fromTable.getRising().isEmpty());
        assertEquals(2, fromList.getTop().size());
        assertEquals("b", fromList.getTop().get(0).get("query"));
    }

    @Test
    void testEmptyRelatedPayload() {
        RelatedMetrics metrics = processor.processRelated(UpstreamPayload.empty(), "Malaria", MetricKind.RELATED_TOPICS);

        assertTrue(metrics.isEmpty());
        assertNull(metrics.getError());
        assertEquals(0, metrics.toJson().get("total_top"));
    }

    // ------------------------------------------------------------------
    // Region
    // ------------------------------------------------------------------

    @Test
    void testRegionsSortedAndLimitedToTen() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            rows.add(row("geoName", "Region " + (char) ('A' + i), "Malaria", i * 5));
        }
        RegionalMetrics metrics = processor.processInterestByRegion(
                UpstreamPayload.table(List.of("geoName", "Malaria"), rows), "Malaria", "GH");

        assertEquals(10, metrics.getTopRegions().size());
        assertEquals(60.0, metrics.getTopRegions().get(0).getInterest());
        assertEquals(15.0, metrics.getTopRegions().get(9).getInterest());
        assertEquals(10, metrics.getRegionalDistribution().size());
    }

    @Test
    void testNumericRegionCodesAreResolved() {
        List<Map<String, Object>> rows = List.of(
                row("geoName", "100", "interest", 90),
                row("geoName", 42, "interest", 70),
                row("geoName", "Volta", "interest", 10));
        RegionalMetrics metrics = processor.processInterestByRegion(
                UpstreamPayload.table(List.of("geoName", "interest"), rows), "Malaria", "GH");

        assertEquals("Greater Accra", metrics.getTopRegions().get(0).getRegion());
        assertEquals("Originally: 100", metrics.getTopRegions().get(0).getRegionNote());
        assertEquals("Ashanti", metrics.getTopRegions().get(1).getRegion());
        assertEquals("Volta", metrics.getTopRegions().get(2).getRegion());
        assertNull(metrics.getTopRegions().get(2).getRegionNote());
        assertEquals(90.0, metrics.getRegionalDistribution().get("Greater Accra"));
    }

    @Test
    void testPositionalColumnsWhenNamesUnknown() {
        List<Map<String, Object>> rows = List.of(
                row("name", "Northern", "hits", 30),
                row("name", "Oti", "hits", "bad"));
        RegionalMetrics metrics = processor.processInterestByRegion(
                UpstreamPayload.table(List.of("name", "hits"), rows), "Malaria", "GH");

        assertEquals(1, metrics.getTopRegions().size());
        assertEquals("Northern", metrics.getTopRegions().get(0).getRegion());
        assertEquals(30.0, metrics.getTopRegions().get(0).getInterest());
    }

    @Test
    void testSingleColumnGetsUnitInterest() {
        RegionalMetrics metrics = processor.processInterestByRegion(
                UpstreamPayload.table(List.of("name"), List.of(row("name", "Savannah"))), "Malaria", "GH");

        assertEquals(1.0, metrics.getTopRegions().get(0).getInterest());
    }

    @Test
    void testRegionsFromFlatListOfRows() {
        RegionalMetrics metrics = processor.processInterestByRegion(
                UpstreamPayload.flatList(List.<Object>of(
                        row("geoName", "Volta", "interest", 40),
                        "ignored",
                        row("geoName", "Oti", "interest", 60))), "Malaria", "GH");

        assertEquals(2, metrics.getTopRegions().size());
        assertEquals("Oti", metrics.getTopRegions().get(0).getRegion());
        assertEquals(40.0, metrics.getRegionalDistribution().get("Volta"));
    }

    @Test
    void testEmptyRegionPayload() {
        RegionalMetrics metrics = processor.processInterestByRegion(UpstreamPayload.empty(), "Malaria", "GH");

        assertTrue(metrics.getTopRegions().isEmpty());
        assertTrue(metrics.getRegionalDistribution().isEmpty());
    }

    @Test
    void testEmptyRecordCarriesError() {
        RelatedMetrics related = (RelatedMetrics) processor.emptyRecord(MetricKind.RELATED_QUERIES, "bad body");

        assertEquals("bad body", related.getError());
        assertEquals("queries", related.getItemLabel());
    }
}
