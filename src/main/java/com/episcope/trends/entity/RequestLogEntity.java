package com.episcope.trends.entity;

import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.RequestStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the trends_request_log table. Rows are insert-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "trends_request_log", indexes = {
        @Index(name = "idx_request_log_timestamp", columnList = "timestamp"),
        @Index(name = "idx_request_log_status", columnList = "status")
})
public class RequestLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "entity", nullable = false, updatable = false, length = 128)
    private String entity;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_kind", nullable = false, updatable = false, length = 32)
    private MetricKind metricKind;

    @Column(name = "timeframe", updatable = false, length = 64)
    private String timeframe;

    @Column(name = "geo", updatable = false, length = 16)
    private String geo;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private RequestStatus status;

    @Column(name = "response_time_ms", updatable = false)
    private Long responseTimeMs;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "cache_hit", updatable = false)
    private boolean cacheHit;
}
