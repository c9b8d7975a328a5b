package com.episcope.trends.service.log;

import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryRequestLog.
 */
class InMemoryRequestLogTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private static RequestLogEntry entry(Instant at, RequestStatus status) {
        return RequestLogEntry.builder()
                .timestamp(at)
                .entity("Malaria")
                .metricKind(MetricKind.INTEREST_OVER_TIME)
                .timeframe("today 1-m")
                .geo("GH")
                .status(status)
                .responseTime(Duration.ofMillis(250))
                .build();
    }

    @Test
    void testRecentReturnsNewestFirst() {
        InMemoryRequestLog log = new InMemoryRequestLog(10);
        log.record(entry(T0, RequestStatus.SUCCESS));
        log.record(entry(T0.plusSeconds(1), RequestStatus.ERROR));
        log.record(entry(T0.plusSeconds(2), RequestStatus.RATE_LIMITED));

        List<RequestLogEntry> recent = log.recent(2);

        assertEquals(2, recent.size());
        assertEquals(RequestStatus.RATE_LIMITED, recent.get(0).getStatus());
        assertEquals(RequestStatus.ERROR, recent.get(1).getStatus());
    }

    @Test
    void testCapacityDropsOldest() {
        InMemoryRequestLog log = new InMemoryRequestLog(2);
        log.record(entry(T0, RequestStatus.ERROR));
        log.record(entry(T0.plusSeconds(1), RequestStatus.SUCCESS));
        log.record(entry(T0.plusSeconds(2), RequestStatus.SUCCESS));

        List<RequestLogEntry> recent = log.recent(10);

        assertEquals(2, recent.size());
        assertTrue(recent.stream().allMatch(e -> e.getStatus() == RequestStatus.SUCCESS));
    }

    @Test
    void testCountsSinceIncludesEveryStatus() {
        InMemoryRequestLog log = new InMemoryRequestLog(10);
        log.record(entry(T0, RequestStatus.ERROR));
        log.record(entry(T0.plusSeconds(60), RequestStatus.SUCCESS));
        log.record(entry(T0.plusSeconds(120), RequestStatus.SUCCESS));

        Map<RequestStatus, Long> counts = log.countsSince(T0.plusSeconds(60));

        assertEquals(2L, counts.get(RequestStatus.SUCCESS));
        assertEquals(0L, counts.get(RequestStatus.ERROR));
        assertEquals(0L, counts.get(RequestStatus.RATE_LIMITED));
    }
}
