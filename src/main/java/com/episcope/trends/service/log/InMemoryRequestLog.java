package com.episcope.trends.service.log;

import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded in-memory request log; the oldest attempts are dropped past capacity.
 */
public class InMemoryRequestLog implements RequestLog {

    private final ConcurrentLinkedDeque<RequestLogEntry> entries = new ConcurrentLinkedDeque<>();
    private final int capacity;

    public InMemoryRequestLog(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void record(RequestLogEntry entry) {
        entries.addFirst(entry);
        while (entries.size() > capacity) {
            entries.pollLast();
        }
    }

    @Override
    public List<RequestLogEntry> recent(int limit) {
        List<RequestLogEntry> result = new ArrayList<>();
        Iterator<RequestLogEntry> it = entries.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public Map<RequestStatus, Long> countsSince(Instant since) {
        Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            counts.put(status, 0L);
        }
        for (RequestLogEntry entry : entries) {
            if (!entry.getTimestamp().isBefore(since)) {
                counts.merge(entry.getStatus(), 1L, Long::sum);
            }
        }
        return counts;
    }
}
