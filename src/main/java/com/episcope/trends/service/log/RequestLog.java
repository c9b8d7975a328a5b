package com.episcope.trends.service.log;

import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of upstream call attempts.
 */
public interface RequestLog {

    /**
     * Append one attempt. Failures to write are logged, never thrown.
     */
    void record(RequestLogEntry entry);

    /**
     * Most recent attempts, newest first.
     */
    List<RequestLogEntry> recent(int limit);

    Map<RequestStatus, Long> countsSince(Instant since);
}
