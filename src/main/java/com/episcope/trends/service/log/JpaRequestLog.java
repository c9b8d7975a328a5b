package com.episcope.trends.service.log;

import com.episcope.trends.entity.RequestLogEntity;
import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;
import com.episcope.trends.repository.RequestLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Request log backed by the trends_request_log table.
 */
@Slf4j
public class JpaRequestLog implements RequestLog {

    private final RequestLogRepository repository;

    public JpaRequestLog(RequestLogRepository repository) {
        this.repository = repository;
    }

    @Override
    public void record(RequestLogEntry entry) {
        try {
            repository.save(RequestLogEntity.builder()
                    .timestamp(entry.getTimestamp())
                    .entity(entry.getEntity())
                    .metricKind(entry.getMetricKind())
                    .timeframe(entry.getTimeframe())
                    .geo(entry.getGeo())
                    .status(entry.getStatus())
                    .responseTimeMs(entry.getResponseTime() != null ? entry.getResponseTime().toMillis() : null)
                    .errorMessage(entry.getErrorMessage())
                    .cacheHit(entry.isCacheHit())
                    .build());
        } catch (Exception e) {
            log.error("Failed to log upstream request for {} - {}", entry.getEntity(), entry.getMetricKind(), e);
        }
    }

    @Override
    public List<RequestLogEntry> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit)).stream()
                .map(e -> RequestLogEntry.builder()
                        .timestamp(e.getTimestamp())
                        .entity(e.getEntity())
                        .metricKind(e.getMetricKind())
                        .timeframe(e.getTimeframe())
                        .geo(e.getGeo())
                        .status(e.getStatus())
                        .responseTime(e.getResponseTimeMs() != null ? Duration.ofMillis(e.getResponseTimeMs()) : null)
                        .errorMessage(e.getErrorMessage())
                        .cacheHit(e.isCacheHit())
                        .build())
                .toList();
    }

    @Override
    public Map<RequestStatus, Long> countsSince(Instant since) {
        Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            counts.put(status, repository.countByStatusSince(status, since));
        }
        return counts;
    }
}
