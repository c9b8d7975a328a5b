package com.episcope.trends.service.cache;

import com.episcope.trends.model.MetricKind;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Stable cache keys for (entity, metric kind, timeframe, geo).
 *
 * Key = SHA-256 hex of "entity:metric_kind:timeframe:geo" in UTF-8, so every
 * process sharing the store computes the same key.
 */
public final class CacheKeyGenerator {

    private CacheKeyGenerator() {
    }

    public static String generate(String entity, MetricKind metricKind, String timeframe, String geo) {
        String raw = nullToEmpty(entity) + ":" + metricKind.getWireName() + ":" + nullToEmpty(timeframe) + ":" + nullToEmpty(geo);
        return DigestUtils.sha256Hex(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
