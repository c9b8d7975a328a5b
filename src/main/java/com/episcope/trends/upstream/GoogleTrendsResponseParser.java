package com.episcope.trends.upstream;

import com.episcope.trends.exception.UpstreamMalformedResponseException;
import com.episcope.trends.model.MetricKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses Google Trends API bodies into {@link UpstreamPayload} variants.
 *
 * Bodies start with an anti-JSON-hijacking prefix (e.g. {@code )]}'}) that is
 * stripped before parsing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleTrendsResponseParser {

    static final String TIMESERIES_WIDGET = "TIMESERIES";
    static final String GEO_MAP_WIDGET = "GEO_MAP";
    static final String RELATED_TOPICS_WIDGET = "RELATED_TOPICS";
    static final String RELATED_QUERIES_WIDGET = "RELATED_QUERIES";

    private final ObjectMapper objectMapper;

    /**
     * Widgets of an explore response keyed by widget id.
     */
    public Map<String, ExploreWidget> parseExplore(String body) {
        JsonNode root = readBody(body);
        JsonNode widgets = root.path("widgets");
        if (!widgets.isArray()) {
            throw new UpstreamMalformedResponseException("Explore response has no widgets");
        }

        Map<String, ExploreWidget> result = new LinkedHashMap<>();
        for (JsonNode widget : widgets) {
            String id = widget.path("id").asText("");
            // Related widgets may carry an index suffix when comparing several terms
            String baseId = id.replaceAll("_\\d+$", "");
            if (!widget.hasNonNull("token") || result.containsKey(baseId)) {
                continue;
            }
            result.put(baseId, new ExploreWidget(baseId, widget.get("token").asText(), widget.path("request")));
        }
        log.debug("Explore response carried widgets: {}", result.keySet());
        return result;
    }

    /**
     * Timeline points as a table with columns {@code date}, the entity and {@code isPartial}.
     */
    public UpstreamPayload parseInterestOverTime(String body, String entity) {
        JsonNode timeline = readDefault(body).path("timelineData");
        if (!timeline.isArray() || timeline.isEmpty()) {
            return UpstreamPayload.empty();
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode point : timeline) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", point.path("formattedTime").asText(point.path("time").asText()));
            row.put("time", point.path("time").asText());
            row.put(entity, firstValue(point));
            row.put("isPartial", point.path("isPartial").asBoolean(false));
            rows.add(row);
        }
        return UpstreamPayload.table(List.of("date", "time", entity, "isPartial"), rows);
    }

    /**
     * Region rows as a table with columns {@code geoName}, {@code geoCode} and the entity.
     */
    public UpstreamPayload parseInterestByRegion(String body, String entity) {
        JsonNode geoData = readDefault(body).path("geoMapData");
        if (!geoData.isArray() || geoData.isEmpty()) {
            return UpstreamPayload.empty();
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode region : geoData) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("geoName", region.path("geoName").asText(""));
            row.put("geoCode", region.path("geoCode").asText(""));
            row.put(entity, firstValue(region));
            rows.add(row);
        }
        return UpstreamPayload.table(List.of("geoName", "geoCode", entity), rows);
    }

    /**
     * Related queries or topics as a keyed block: entity to {@code top} and {@code rising} tables.
     */
    public UpstreamPayload parseRelated(String body, String entity, MetricKind kind) {
        JsonNode rankedList = readDefault(body).path("rankedList");
        if (!rankedList.isArray()) {
            throw new UpstreamMalformedResponseException("Related response has no rankedList");
        }

        Map<String, UpstreamPayload> sections = new LinkedHashMap<>();
        sections.put("top", rankedTable(rankedList.path(0).path("rankedKeyword"), kind));
        sections.put("rising", rankedTable(rankedList.path(1).path("rankedKeyword"), kind));

        Map<String, Map<String, UpstreamPayload>> blocks = new LinkedHashMap<>();
        blocks.put(entity, sections);
        return UpstreamPayload.keyedBlock(blocks);
    }

    private UpstreamPayload rankedTable(JsonNode keywords, MetricKind kind) {
        boolean topics = kind == MetricKind.RELATED_TOPICS;
        List<String> columns = topics
                ? List.of("topic_title", "topic_type", "topic_mid", "value", "formattedValue")
                : List.of("query", "value", "formattedValue");

        List<Map<String, Object>> rows = new ArrayList<>();
        if (keywords.isArray()) {
            for (JsonNode keyword : keywords) {
                Map<String, Object> row = new LinkedHashMap<>();
                if (topics) {
                    JsonNode topic = keyword.path("topic");
                    row.put("topic_title", topic.path("title").asText(""));
                    row.put("topic_type", topic.path("type").asText(""));
                    row.put("topic_mid", topic.path("mid").asText(""));
                } else {
                    row.put("query", keyword.path("query").asText(""));
                }
                row.put("value", keyword.path("value").asInt(0));
                row.put("formattedValue", keyword.path("formattedValue").asText(""));
                rows.add(row);
            }
        }
        return UpstreamPayload.table(columns, rows);
    }

    private static Object firstValue(JsonNode node) {
        JsonNode values = node.path("value");
        if (values.isArray() && !values.isEmpty()) {
            return values.get(0).asDouble();
        }
        return null;
    }

    private JsonNode readDefault(String body) {
        JsonNode data = readBody(body).path("default");
        if (data.isMissingNode() || !data.isObject()) {
            throw new UpstreamMalformedResponseException("Widget response has no 'default' object");
        }
        return data;
    }

    private JsonNode readBody(String body) {
        if (body == null) {
            throw new UpstreamMalformedResponseException("Empty response body");
        }
        int start = body.indexOf('{');
        if (start < 0) {
            throw new UpstreamMalformedResponseException("Response body is not JSON");
        }
        try {
            return objectMapper.readTree(body.substring(start));
        } catch (JsonProcessingException e) {
            throw new UpstreamMalformedResponseException("Failed to parse upstream response: " + e.getOriginalMessage(), e);
        }
    }
}
