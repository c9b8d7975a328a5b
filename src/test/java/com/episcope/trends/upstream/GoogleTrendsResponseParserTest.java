package com.episcope.trends.upstream;

import com.episcope.trends.config.JacksonConfiguration;
import com.episcope.trends.exception.UpstreamMalformedResponseException;
import com.episcope.trends.model.MetricKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GoogleTrendsResponseParser.
 */
class GoogleTrendsResponseParserTest {

    private static final String PREFIX = ")]}'\n";

    private GoogleTrendsResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new GoogleTrendsResponseParser(JacksonConfiguration.createObjectMapper());
    }

    @Test
    void testParseExploreStripsPrefixAndIndexSuffix() {
        String body = PREFIX + "{\"widgets\":["
                + "{\"id\":\"TIMESERIES\",\"token\":\"t1\",\"request\":{\"time\":\"today 1-m\"}},"
                + "{\"id\":\"GEO_MAP\",\"token\":\"t2\",\"request\":{}},"
                + "{\"id\":\"RELATED_QUERIES_0\",\"token\":\"t3\",\"request\":{}},"
                + "{\"id\":\"RELATED_QUERIES_1\",\"token\":\"t4\",\"request\":{}},"
                + "{\"id\":\"RELATED_TOPICS\",\"request\":{}}"
                + "]}";

        Map<String, ExploreWidget> widgets = parser.parseExplore(body);

        assertEquals(3, widgets.size());
        assertEquals("t1", widgets.get(GoogleTrendsResponseParser.TIMESERIES_WIDGET).getToken());
        assertEquals("today 1-m", widgets.get("TIMESERIES").getRequest().path("time").asText());
        assertEquals("t3", widgets.get(GoogleTrendsResponseParser.RELATED_QUERIES_WIDGET).getToken());
        assertFalse(widgets.containsKey(GoogleTrendsResponseParser.RELATED_TOPICS_WIDGET));
    }

    @Test
    void testParseExploreWithoutWidgetsFails() {
        assertThrows(UpstreamMalformedResponseException.class, () -> parser.parseExplore(PREFIX + "{\"other\":1}"));
    }

    @Test
    void testNonJsonBodyFails() {
        assertThrows(UpstreamMalformedResponseException.class, () -> parser.parseExplore("<html>blocked</html>"));
        assertThrows(UpstreamMalformedResponseException.class, () -> parser.parseExplore(null));
        assertThrows(UpstreamMalformedResponseException.class, () -> parser.parseExplore(PREFIX + "{\"widgets\":[}"));
    }

    @Test
    void testParseInterestOverTime() {
        String body = PREFIX + "{\"default\":{\"timelineData\":["
                + "{\"time\":\"1704067200\",\"formattedTime\":\"Jan 1, 2024\",\"value\":[12]},"
                + "{\"time\":\"1704153600\",\"formattedTime\":\"Jan 2, 2024\",\"value\":[30],\"isPartial\":true}"
                + "]}}";

        UpstreamPayload payload = parser.parseInterestOverTime(body, "Malaria");

        assertEquals(UpstreamPayload.Shape.TABLE, payload.getShape());
        UpstreamPayload.Table table = (UpstreamPayload.Table) payload;
        assertEquals(List.of("date", "time", "Malaria", "isPartial"), table.getColumns());
        assertEquals(2, table.getRows().size());
        assertEquals("Jan 1, 2024", table.getRows().get(0).get("date"));
        assertEquals(30.0, table.getRows().get(1).get("Malaria"));
        assertEquals(Boolean.TRUE, table.getRows().get(1).get("isPartial"));
    }

    @Test
    void testEmptyTimelineIsEmptyPayload() {
        UpstreamPayload payload = parser.parseInterestOverTime(PREFIX + "{\"default\":{\"timelineData\":[]}}", "Malaria");

        assertEquals(UpstreamPayload.Shape.EMPTY, payload.getShape());
    }

    @Test
    void testMissingDefaultFails() {
        assertThrows(UpstreamMalformedResponseException.class,
                () -> parser.parseInterestOverTime(PREFIX + "{\"timelineData\":[]}", "Malaria"));
    }

    @Test
    void testParseInterestByRegion() {
        String body = PREFIX + "{\"default\":{\"geoMapData\":["
                + "{\"geoCode\":\"GH-AA\",\"geoName\":\"Greater Accra\",\"value\":[100]},"
                + "{\"geoCode\":\"GH-AH\",\"geoName\":\"Ashanti\",\"value\":[]}"
                + "]}}";

        UpstreamPayload.Table table = (UpstreamPayload.Table) parser.parseInterestByRegion(body, "Cholera");

        assertEquals(List.of("geoName", "geoCode", "Cholera"), table.getColumns());
        assertEquals("Greater Accra", table.getRows().get(0).get("geoName"));
        assertEquals(100.0, table.getRows().get(0).get("Cholera"));
        assertNull(table.getRows().get(1).get("Cholera"));
    }

    @Test
    void testParseRelatedQueries() {
        String body = PREFIX + "{\"default\":{\"rankedList\":["
                + "{\"rankedKeyword\":[{\"query\":\"malaria symptoms\",\"value\":100,\"formattedValue\":\"100\"}]},"
                + "{\"rankedKeyword\":[{\"query\":\"malaria vaccine\",\"value\":350,\"formattedValue\":\"+350%\"}]}"
                + "]}}";

        UpstreamPayload payload = parser.parseRelated(body, "Malaria", MetricKind.RELATED_QUERIES);

        assertEquals(UpstreamPayload.Shape.KEYED_BLOCK, payload.getShape());
        Map<String, UpstreamPayload> sections = ((UpstreamPayload.KeyedBlock) payload).getBlocks().get("Malaria");
        UpstreamPayload.Table top = (UpstreamPayload.Table) sections.get("top");
        UpstreamPayload.Table rising = (UpstreamPayload.Table) sections.get("rising");
        assertEquals("malaria symptoms", top.getRows().get(0).get("query"));
        assertEquals(350, rising.getRows().get(0).get("value"));
        assertEquals("+350%", rising.getRows().get(0).get("formattedValue"));
    }

    @Test
    void testParseRelatedTopics() {
        String body = PREFIX + "{\"default\":{\"rankedList\":["
                + "{\"rankedKeyword\":[{\"topic\":{\"mid\":\"/m/05d5h\",\"title\":\"Malaria\",\"type\":\"Disease\"},"
                + "\"value\":100,\"formattedValue\":\"100\"}]}"
                + "]}}";

        UpstreamPayload.KeyedBlock block = (UpstreamPayload.KeyedBlock)
                parser.parseRelated(body, "Malaria", MetricKind.RELATED_TOPICS);

        UpstreamPayload.Table top = (UpstreamPayload.Table) block.getBlocks().get("Malaria").get("top");
        UpstreamPayload.Table rising = (UpstreamPayload.Table) block.getBlocks().get("Malaria").get("rising");
        assertEquals("Malaria", top.getRows().get(0).get("topic_title"));
        assertEquals("/m/05d5h", top.getRows().get(0).get("topic_mid"));
        assertTrue(rising.isEmpty());
    }

    @Test
    void testRelatedWithoutRankedListFails() {
        assertThrows(UpstreamMalformedResponseException.class,
                () -> parser.parseRelated(PREFIX + "{\"default\":{}}", "Malaria", MetricKind.RELATED_QUERIES));
    }
}
