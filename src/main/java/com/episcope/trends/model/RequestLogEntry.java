package com.episcope.trends.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One upstream call attempt. Immutable once written.
 */
@Value
@Builder
public class RequestLogEntry {
    Instant timestamp;
    String entity;
    MetricKind metricKind;
    String timeframe;
    String geo;
    RequestStatus status;
    Duration responseTime;
    String errorMessage;
    /**
     * Always false for upstream attempts; kept for parity with call-site instrumentation.
     */
    boolean cacheHit;
}
