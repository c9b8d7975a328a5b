package com.episcope.trends.service.processing;

import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.payload.InterestOverTimeMetrics;
import com.episcope.trends.model.payload.MetricPayload;
import com.episcope.trends.model.payload.RegionalMetrics;
import com.episcope.trends.model.payload.RelatedMetrics;
import com.episcope.trends.model.payload.TrendDirection;
import com.episcope.trends.upstream.UpstreamPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes raw upstream payloads into canonical metric records.
 *
 * Never throws: unexpected shapes or values yield an empty record, annotated with
 * an error when the input could not be interpreted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataProcessor {

    private static final int TREND_WINDOW = 3;
    private static final double RISING_FACTOR = 1.1;
    private static final double FALLING_FACTOR = 0.9;
    private static final int SEARCH_ESTIMATE_FACTOR = 10000;
    private static final int TOP_REGIONS = 10;

    private static final List<String> REGION_COLUMNS = List.of("geoName", "region", "location", "geo", "country", "state");
    private static final List<String> INTEREST_COLUMNS = List.of("interest", "value", "score", "count");

    private final RegionNameResolver regionNameResolver;

    public MetricPayload process(MetricKind kind, UpstreamPayload payload, String entity, String geo) {
        switch (kind) {
            case INTEREST_OVER_TIME:
                return processInterestOverTime(payload, entity);
            case RELATED_QUERIES:
            case RELATED_TOPICS:
                return processRelated(payload, entity, kind);
            case INTEREST_BY_REGION:
                return processInterestByRegion(payload, entity, geo);
            default:
                throw new IllegalArgumentException("Unsupported metric kind: " + kind);
        }
    }

    /**
     * Empty record of the kind's shape carrying an error note.
     */
    public MetricPayload emptyRecord(MetricKind kind, String error) {
        switch (kind) {
            case INTEREST_OVER_TIME:
                return InterestOverTimeMetrics.empty(error);
            case RELATED_QUERIES:
            case RELATED_TOPICS:
                return RelatedMetrics.empty(kind.getItemLabel(), error);
            case INTEREST_BY_REGION:
                return RegionalMetrics.empty(error);
            default:
                throw new IllegalArgumentException("Unsupported metric kind: " + kind);
        }
    }

    // ------------------------------------------------------------------
    // Interest over time
    // ------------------------------------------------------------------

    public InterestOverTimeMetrics processInterestOverTime(UpstreamPayload payload, String entity) {
        try {
            switch (payload.getShape()) {
                case TABLE:
                    return summarize(seriesFromTable((UpstreamPayload.Table) payload, entity));
                case FLAT_LIST:
                    return summarize(seriesFromList(((UpstreamPayload.FlatList) payload).getItems(), entity));
                case KEYED_BLOCK:
                    UpstreamPayload.Table table = firstTable(entityBlock((UpstreamPayload.KeyedBlock) payload, entity));
                    return table != null
                            ? summarize(seriesFromTable(table, entity))
                            : InterestOverTimeMetrics.empty("No interest data for " + entity);
                default:
                    return InterestOverTimeMetrics.empty(null);
            }
        } catch (RuntimeException e) {
            log.error("Error processing interest over time for {}", entity, e);
            return InterestOverTimeMetrics.empty(describe(e));
        }
    }

    private List<Double> seriesFromTable(UpstreamPayload.Table table, String entity) {
        String valueColumn = findColumn(table.getColumns(), entity, INTEREST_COLUMNS);
        if (valueColumn == null) {
            log.warn("No interest column for {} among {}", entity, table.getColumns());
            return List.of();
        }

        List<Map<String, Object>> rows = new ArrayList<>(table.getRows());
        String timeColumn = table.getColumns().contains("time") ? "time" : null;
        String dateColumn = table.getColumns().contains("date") ? "date" : null;
        if (timeColumn != null) {
            rows.sort(Comparator.comparing(row -> orderKey(toDouble(row.get(timeColumn)))));
        } else if (dateColumn != null) {
            rows.sort(Comparator.comparing(row -> String.valueOf(row.get(dateColumn))));
        }

        List<Double> series = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Double value = toDouble(row.get(valueColumn));
            if (value != null) {
                series.add(value);
            }
        }
        return series;
    }

    private List<Double> seriesFromList(List<Object> items, String entity) {
        List<Double> series = new ArrayList<>();
        for (Object item : items) {
            Object raw = item;
            if (item instanceof Map) {
                Map<String, Object> row = asRow((Map<?, ?>) item);
                String column = findColumn(new ArrayList<>(row.keySet()), entity, INTEREST_COLUMNS);
                raw = column != null ? row.get(column) : null;
            }
            Double value = toDouble(raw);
            if (value != null) {
                series.add(value);
            }
        }
        return series;
    }

    private static double orderKey(Double value) {
        return value != null ? value : Double.MAX_VALUE;
    }

    InterestOverTimeMetrics summarize(List<Double> series) {
        if (series.isEmpty()) {
            return InterestOverTimeMetrics.empty(null);
        }

        double peak = series.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        double average = series.stream().mapToDouble(Double::doubleValue).average().orElse(0);

        TrendDirection direction = TrendDirection.STABLE;
        double strength = 0.0;
        if (series.size() >= 2) {
            int window = Math.min(TREND_WINDOW, series.size());
            double older = mean(series.subList(0, window));
            double recent = mean(series.subList(series.size() - window, series.size()));

            if (recent > older * RISING_FACTOR) {
                direction = TrendDirection.RISING;
                strength = older > 0 ? Math.min(1.0, (recent - older) / older) : 0.0;
            } else if (recent < older * FALLING_FACTOR) {
                direction = TrendDirection.FALLING;
                strength = older > 0 ? Math.min(1.0, (older - recent) / older) : 0.0;
            }
        }

        return InterestOverTimeMetrics.builder()
                .currentInterest(series.get(series.size() - 1))
                .peakInterest(peak)
                .averageInterest(round2(average))
                .trendDirection(direction)
                .trendStrength(round2(strength))
                .totalSearches((long) (average * SEARCH_ESTIMATE_FACTOR))
                .dataPoints(series.size())
                .build();
    }

    // ------------------------------------------------------------------
    // Related queries / topics
    // ------------------------------------------------------------------

    public RelatedMetrics processRelated(UpstreamPayload payload, String entity, MetricKind kind) {
        String label = kind.getItemLabel();
        try {
            switch (payload.getShape()) {
                case TABLE:
                    return new RelatedMetrics(label, rowsOf(payload), new ArrayList<>(), null);
                case FLAT_LIST:
                    return new RelatedMetrics(label, itemsAsRows(((UpstreamPayload.FlatList) payload).getItems(), kind),
                            new ArrayList<>(), null);
                case KEYED_BLOCK:
                    return relatedFromBlock((UpstreamPayload.KeyedBlock) payload, entity, kind);
                default:
                    return RelatedMetrics.empty(label, null);
            }
        } catch (RuntimeException e) {
            log.error("Error processing {} for {}", kind, entity, e);
            return RelatedMetrics.empty(label, describe(e));
        }
    }

    private RelatedMetrics relatedFromBlock(UpstreamPayload.KeyedBlock block, String entity, MetricKind kind) {
        Map<String, UpstreamPayload> sections = entityBlock(block, entity);
        if (sections == null) {
            log.warn("Unexpected {} structure for {}: keys {}", kind, entity, block.getBlocks().keySet());
            return RelatedMetrics.empty(kind.getItemLabel(), null);
        }

        List<Map<String, Object>> top = sectionRows(sections.get("top"), kind);
        List<Map<String, Object>> rising = sectionRows(sections.get("rising"), kind);

        if (top.isEmpty() && rising.isEmpty()) {
            for (Map.Entry<String, UpstreamPayload> section : sections.entrySet()) {
                List<Map<String, Object>> rows = sectionRows(section.getValue(), kind);
                if (!rows.isEmpty()) {
                    log.debug("Using '{}' section for {} of {}", section.getKey(), kind, entity);
                    top = rows;
                    break;
                }
            }
        }
        return new RelatedMetrics(kind.getItemLabel(), top, rising, null);
    }

    private List<Map<String, Object>> sectionRows(UpstreamPayload section, MetricKind kind) {
        if (section == null) {
            return new ArrayList<>();
        }
        switch (section.getShape()) {
            case TABLE:
                return rowsOf(section);
            case FLAT_LIST:
                return itemsAsRows(((UpstreamPayload.FlatList) section).getItems(), kind);
            default:
                return new ArrayList<>();
        }
    }

    private static List<Map<String, Object>> rowsOf(UpstreamPayload payload) {
        List<Map<String, Object>> rows = new ArrayList<>();
        ((UpstreamPayload.Table) payload).getRows().forEach(row -> rows.add(new LinkedHashMap<>(row)));
        return rows;
    }

    private static List<Map<String, Object>> itemsAsRows(List<Object> items, MetricKind kind) {
        String key = kind == MetricKind.RELATED_TOPICS ? "topic_title" : "query";
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : items) {
            if (item == null) {
                continue;
            }
            if (item instanceof Map) {
                rows.add(asRow((Map<?, ?>) item));
            } else {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(key, String.valueOf(item));
                rows.add(row);
            }
        }
        return rows;
    }

    // ------------------------------------------------------------------
    // Interest by region
    // ------------------------------------------------------------------

    public RegionalMetrics processInterestByRegion(UpstreamPayload payload, String entity, String geo) {
        try {
            UpstreamPayload.Table table;
            switch (payload.getShape()) {
                case TABLE:
                    table = (UpstreamPayload.Table) payload;
                    break;
                case KEYED_BLOCK:
                    table = firstTable(entityBlock((UpstreamPayload.KeyedBlock) payload, entity));
                    break;
                case FLAT_LIST:
                    table = tableFromItems(((UpstreamPayload.FlatList) payload).getItems());
                    break;
                default:
                    table = null;
            }
            if (table == null || table.isEmpty()) {
                log.warn("No interest by region data for {}", entity);
                return RegionalMetrics.empty(null);
            }
            return regionsFromTable(table, entity, geo);
        } catch (RuntimeException e) {
            log.error("Error processing interest by region for {}", entity, e);
            return RegionalMetrics.empty(describe(e));
        }
    }

    private RegionalMetrics regionsFromTable(UpstreamPayload.Table table, String entity, String geo) {
        RegionalMetrics result = RegionalMetrics.builder().build();
        String regionColumn = findColumn(table.getColumns(), null, REGION_COLUMNS);
        String interestColumn = findColumn(table.getColumns(), entity, INTEREST_COLUMNS);

        if (regionColumn != null && interestColumn != null) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Map<String, Object> row : table.getRows()) {
                if (toDouble(row.get(interestColumn)) != null && row.get(regionColumn) != null) {
                    rows.add(row);
                }
            }
            rows.sort(Comparator.comparing((Map<String, Object> row) -> toDouble(row.get(interestColumn))).reversed());
            for (Map<String, Object> row : rows.subList(0, Math.min(TOP_REGIONS, rows.size()))) {
                addRegion(result, regionCode(row.get(regionColumn)), toDouble(row.get(interestColumn)), geo);
            }
        }

        if (result.getTopRegions().isEmpty() && !table.getColumns().isEmpty()) {
            String first = table.getColumns().get(0);
            String second = table.getColumns().size() > 1 ? table.getColumns().get(1) : null;
            log.info("No standard region columns for {}, using '{}' and '{}' by position", entity, first, second);
            for (Map<String, Object> row : table.getRows().subList(0, Math.min(TOP_REGIONS, table.getRows().size()))) {
                String code = regionCode(row.get(first));
                Double interest = second != null ? toDouble(row.get(second)) : Double.valueOf(1.0);
                if (code == null || code.isEmpty() || interest == null) {
                    continue;
                }
                addRegion(result, code, interest, geo);
            }
        }
        return result;
    }

    private void addRegion(RegionalMetrics result, String code, double interest, String geo) {
        String region = code;
        String note = null;
        if (isDigits(code)) {
            region = regionNameResolver.resolve(code, geo);
            note = "Originally: " + code;
        }
        result.getTopRegions().add(new RegionalMetrics.RegionInterest(region, interest, note));
        result.getRegionalDistribution().put(region, interest);
    }

    private static UpstreamPayload.Table tableFromItems(List<Object> items) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map) {
                Map<String, Object> row = asRow((Map<?, ?>) item);
                columns.addAll(row.keySet());
                rows.add(row);
            }
        }
        return UpstreamPayload.table(new ArrayList<>(columns), rows);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Copy of a list item as a row keyed by column name.
     */
    private static Map<String, Object> asRow(Map<?, ?> item) {
        Map<String, Object> row = new LinkedHashMap<>();
        item.forEach((column, value) -> row.put(String.valueOf(column), value));
        return row;
    }

    /**
     * Sections for the entity, matched case-insensitively; null when absent.
     */
    private static Map<String, UpstreamPayload> entityBlock(UpstreamPayload.KeyedBlock block, String entity) {
        for (Map.Entry<String, Map<String, UpstreamPayload>> entry : block.getBlocks().entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(entity)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static UpstreamPayload.Table firstTable(Map<String, UpstreamPayload> sections) {
        if (sections == null) {
            return null;
        }
        for (UpstreamPayload section : sections.values()) {
            if (section != null && section.getShape() == UpstreamPayload.Shape.TABLE) {
                return (UpstreamPayload.Table) section;
            }
        }
        return null;
    }

    /**
     * First column matching the entity (case-insensitive), then the candidates in order.
     */
    private static String findColumn(List<String> columns, String entity, List<String> candidates) {
        if (entity != null) {
            for (String column : columns) {
                if (column != null && column.equalsIgnoreCase(entity)) {
                    return column;
                }
            }
        }
        for (String candidate : candidates) {
            if (columns.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    static Double toDouble(Object value) {
        Double result = null;
        if (value instanceof Number) {
            result = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                result = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return result != null && Double.isFinite(result) ? result : null;
    }

    private static String regionCode(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return String.valueOf((long) number);
            }
        }
        return String.valueOf(value).trim();
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
