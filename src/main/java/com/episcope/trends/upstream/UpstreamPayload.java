package com.episcope.trends.upstream;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw upstream result for one metric kind, in one of a small set of shapes.
 * Consumers switch on {@link #getShape()} instead of probing the object.
 */
public abstract class UpstreamPayload {

    public enum Shape {
        TABLE,
        KEYED_BLOCK,
        FLAT_LIST,
        EMPTY
    }

    public abstract Shape getShape();

    public static Table table(List<String> columns, List<Map<String, Object>> rows) {
        return new Table(columns, rows);
    }

    public static KeyedBlock keyedBlock(Map<String, Map<String, UpstreamPayload>> blocks) {
        return new KeyedBlock(blocks);
    }

    public static FlatList flatList(List<Object> items) {
        return new FlatList(items);
    }

    public static Empty empty() {
        return Empty.INSTANCE;
    }

    /**
     * Column-oriented rows, e.g. a time series or region breakdown.
     */
    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Table extends UpstreamPayload {
        private final List<String> columns;
        private final List<Map<String, Object>> rows;

        private Table(List<String> columns, List<Map<String, Object>> rows) {
            this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
            List<Map<String, Object>> copy = new ArrayList<>(rows.size());
            rows.forEach(row -> copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row))));
            this.rows = Collections.unmodifiableList(copy);
        }

        @Override
        public Shape getShape() {
            return Shape.TABLE;
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }

    /**
     * Entity name to named sections ("top", "rising", ...), each itself a payload.
     */
    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class KeyedBlock extends UpstreamPayload {
        private final Map<String, Map<String, UpstreamPayload>> blocks;

        private KeyedBlock(Map<String, Map<String, UpstreamPayload>> blocks) {
            Map<String, Map<String, UpstreamPayload>> copy = new LinkedHashMap<>();
            blocks.forEach((key, sections) ->
                    copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(sections))));
            this.blocks = Collections.unmodifiableMap(copy);
        }

        @Override
        public Shape getShape() {
            return Shape.KEYED_BLOCK;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class FlatList extends UpstreamPayload {
        private final List<Object> items;

        private FlatList(List<Object> items) {
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public Shape getShape() {
            return Shape.FLAT_LIST;
        }
    }

    @ToString
    public static final class Empty extends UpstreamPayload {
        private static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public Shape getShape() {
            return Shape.EMPTY;
        }
    }
}
