package com.episcope.trends.service.cache;

import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.FetchErrorKind;
import com.episcope.trends.model.MetricKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CaffeineCacheStore.
 */
class CaffeineCacheStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private CaffeineCacheStore store;
    private FreshnessPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FreshnessPolicy(Duration.ofHours(6), 0.25);
        store = new CaffeineCacheStore(Caffeine.newBuilder().maximumSize(100).build(), policy);
    }

    private CacheEntry entry(String entity, MetricKind kind) {
        String key = CacheKeyGenerator.generate(entity, kind, "now 7-d", "GH");
        return CacheEntry.builder()
                .key(key)
                .entity(entity)
                .metricKind(kind)
                .timeframe("now 7-d")
                .geo("GH")
                .payload(payload(1))
                .fetchedAt(NOW)
                .expiresAt(policy.expiryFor(NOW))
                .fetchCount(1)
                .build();
    }

    private static JsonNode payload(int value) {
        return JsonNodeFactory.instance.objectNode().put("current_interest", value);
    }

    @Test
    void testPutAndGet() {
        CacheEntry entry = entry("Malaria", MetricKind.INTEREST_OVER_TIME);
        store.put(entry);

        Optional<CacheEntry> loaded = store.get(entry.getKey());
        assertTrue(loaded.isPresent());
        assertEquals("Malaria", loaded.get().getEntity());
        assertEquals(1, loaded.get().getPayload().get("current_interest").asInt());
    }

    @Test
    void testGetReturnsCopy() {
        CacheEntry entry = entry("Malaria", MetricKind.INTEREST_OVER_TIME);
        store.put(entry);

        store.get(entry.getKey()).get().setRetryCount(99);

        assertEquals(0, store.get(entry.getKey()).get().getRetryCount());
    }

    @Test
    void testTouchAccessDoesNotChangeFreshness() {
        CacheEntry entry = entry("Malaria", MetricKind.INTEREST_OVER_TIME);
        store.put(entry);

        store.touchAccess(entry.getKey(), NOW.plus(Duration.ofHours(1)));

        CacheEntry loaded = store.get(entry.getKey()).get();
        assertEquals(NOW.plus(Duration.ofHours(1)), loaded.getLastAccessedAt());
        assertEquals(entry.getExpiresAt(), loaded.getExpiresAt());
        assertEquals(entry.getFetchedAt(), loaded.getFetchedAt());
    }

    @Test
    void testFailuresThenSuccessResetRetryCount() {
        CacheEntry entry = entry("Cholera", MetricKind.RELATED_QUERIES);
        store.put(entry);

        store.update(entry.getKey(), e -> e.withFailure("boom", FetchErrorKind.UPSTREAM_ERROR, NOW));
        store.update(entry.getKey(), e -> e.withFailure("rate limited", FetchErrorKind.RATE_LIMITED, NOW));

        CacheEntry failed = store.get(entry.getKey()).get();
        assertEquals(2, failed.getRetryCount());
        assertEquals(FetchErrorKind.RATE_LIMITED, failed.getLastErrorKind());
        assertEquals(1, failed.getPayload().get("current_interest").asInt());

        Instant later = NOW.plus(Duration.ofHours(7));
        store.update(entry.getKey(), e -> e.withSuccess(payload(5), later, policy.expiryFor(later)));

        CacheEntry recovered = store.get(entry.getKey()).get();
        assertEquals(0, recovered.getRetryCount());
        assertEquals(2, recovered.getFetchCount());
        assertNull(recovered.getLastError());
        assertNull(recovered.getLastErrorKind());
        assertEquals(5, recovered.getPayload().get("current_interest").asInt());
    }

    @Test
    void testUpdateReturningNullLeavesAbsentKeyAbsent() {
        Optional<CacheEntry> result = store.update("missing", current -> null);

        assertFalse(result.isPresent());
        assertFalse(store.get("missing").isPresent());
    }

    @Test
    void testDeleteByFilter() {
        store.put(entry("Malaria", MetricKind.INTEREST_OVER_TIME));
        store.put(entry("Malaria", MetricKind.RELATED_QUERIES));
        store.put(entry("Cholera", MetricKind.INTEREST_OVER_TIME));
        store.put(entry("Cholera", MetricKind.RELATED_TOPICS));

        assertEquals(1, store.delete("Malaria", MetricKind.RELATED_QUERIES));
        assertEquals(2, store.delete(null, MetricKind.INTEREST_OVER_TIME));
        assertEquals(1, store.delete("Cholera", null));
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void testDeleteAll() {
        store.put(entry("Malaria", MetricKind.INTEREST_OVER_TIME));
        store.put(entry("Diabetes", MetricKind.INTEREST_BY_REGION));

        assertEquals(2, store.delete(null, null));
        assertEquals(0, store.delete(null, null));
    }
}
