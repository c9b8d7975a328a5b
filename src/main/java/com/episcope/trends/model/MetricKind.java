package com.episcope.trends.model;

import com.episcope.trends.exception.InvalidMetricKindException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kinds of search interest metrics served by the upstream source.
 */
public enum MetricKind {

    INTEREST_OVER_TIME("interest_over_time", null),
    RELATED_QUERIES("related_queries", "queries"),
    RELATED_TOPICS("related_topics", "topics"),
    INTEREST_BY_REGION("interest_by_region", null);

    private final String wireName;
    private final String itemLabel;

    MetricKind(String wireName, String itemLabel) {
        this.wireName = wireName;
        this.itemLabel = itemLabel;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Suffix of the top/rising list fields ("queries" or "topics"), null for other kinds.
     */
    public String getItemLabel() {
        return itemLabel;
    }

    /**
     * Kinds whose payloads are often empty for short windows and can be retried
     * with a denser timeframe.
     */
    public boolean supportsFallback() {
        return this != INTEREST_OVER_TIME;
    }

    @JsonCreator
    public static MetricKind fromWireName(String value) {
        if (value != null) {
            for (MetricKind kind : values()) {
                if (kind.wireName.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new InvalidMetricKindException("Invalid metric kind: " + value + ". Valid: " +
                Arrays.stream(values()).map(MetricKind::getWireName).collect(Collectors.joining(", ")));
    }

    /**
     * Parse wire names, dropping duplicates and keeping the given order.
     */
    public static List<MetricKind> fromWireNames(Collection<String> values) {
        Set<MetricKind> kinds = new LinkedHashSet<>();
        if (values != null) {
            values.forEach(value -> kinds.add(fromWireName(value)));
        }
        return new ArrayList<>(kinds);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
