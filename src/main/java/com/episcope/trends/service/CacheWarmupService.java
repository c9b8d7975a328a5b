package com.episcope.trends.service;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.model.FetchOptions;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.ResponseCacheStatus;
import com.episcope.trends.model.TrendsResponse;
import com.episcope.trends.model.dto.WarmupReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Populates the cache for every tracked entity and configured timeframe.
 */
@Slf4j
@Service
public class CacheWarmupService {

    private static final List<MetricKind> ALL_KINDS = List.copyOf(EnumSet.allOf(MetricKind.class));

    private final FetchOrchestrator orchestrator;
    private final TrendsProperties properties;
    private final Clock clock;

    public CacheWarmupService(FetchOrchestrator orchestrator, TrendsProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${trends.warmup.cron:0 0 */6 * * *}")
    public void scheduledWarmup() {
        if (!properties.getWarmup().isEnabled()) {
            return;
        }
        warmUp(properties.getWarmup().isForce());
    }

    /**
     * Fetch all metric kinds for every entity and warm-up timeframe.
     *
     * @param force refetch even when cached entries are fresh
     */
    public WarmupReport warmUp(boolean force) {
        Instant started = clock.instant();
        WarmupReport report = new WarmupReport();
        FetchOptions options = FetchOptions.builder().forceRefresh(force).build();
        String geo = properties.getDefaultGeo();

        log.info("Cache warm-up started: entities={}, timeframes={}, force={}",
                properties.getEntities(), properties.getWarmup().getTimeframes(), force);

        for (String entity : properties.getEntities()) {
            for (String timeframe : properties.getWarmup().getTimeframes()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Cache warm-up interrupted after {} batches", report.getBatches());
                    report.setDuration(Duration.between(started, clock.instant()));
                    return report;
                }
                report.setBatches(report.getBatches() + 1);
                try {
                    TrendsResponse response = orchestrator.getMetrics(entity, ALL_KINDS, timeframe, geo, options);
                    ResponseCacheStatus status = response.getCacheStatus();
                    if (status == ResponseCacheStatus.FRESH) {
                        report.setFresh(report.getFresh() + 1);
                    } else if (status == ResponseCacheStatus.STALE_CACHED) {
                        report.setStaleCached(report.getStaleCached() + 1);
                    } else {
                        report.setFailed(report.getFailed() + 1);
                        report.getErrors().add(entity + " (" + timeframe + "): " + status.getWireName());
                    }
                    log.info("Warmed {} ({}): {}", entity, timeframe, status.getWireName());
                } catch (RuntimeException e) {
                    log.error("Cache warm-up failed for {} ({})", entity, timeframe, e);
                    report.setFailed(report.getFailed() + 1);
                    report.getErrors().add(entity + " (" + timeframe + "): " + e.getMessage());
                }
            }
        }

        report.setDuration(Duration.between(started, clock.instant()));
        log.info("Cache warm-up finished: batches={}, fresh={}, stale={}, failed={} in {}s", report.getBatches(),
                report.getFresh(), report.getStaleCached(), report.getFailed(), report.getDuration().toSeconds());
        return report;
    }
}
