package com.episcope.trends.testsupport;

import com.episcope.trends.exception.UpstreamUnavailableException;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.upstream.TrendsClient;
import com.episcope.trends.upstream.TrendsSession;
import com.episcope.trends.upstream.UpstreamPayload;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted upstream: each metric kind returns queued payloads or throws queued
 * exceptions, falling back to an empty payload once its queue is drained.
 */
public class FakeTrendsClient implements TrendsClient {

    private final Map<MetricKind, Deque<Object>> responses = new EnumMap<>(MetricKind.class);
    private final List<String> sessions = new ArrayList<>();
    private final List<MetricKind> fetches = new ArrayList<>();
    private boolean available = true;
    private RuntimeException buildFailure;

    public FakeTrendsClient respond(MetricKind kind, UpstreamPayload payload) {
        responses.computeIfAbsent(kind, k -> new ArrayDeque<>()).add(payload);
        return this;
    }

    public FakeTrendsClient fail(MetricKind kind, RuntimeException failure) {
        responses.computeIfAbsent(kind, k -> new ArrayDeque<>()).add(failure);
        return this;
    }

    public FakeTrendsClient failBuildRequest(RuntimeException failure) {
        this.buildFailure = failure;
        return this;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Sessions opened, as "entity|timeframe|geo".
     */
    public List<String> getSessions() {
        return sessions;
    }

    public List<MetricKind> getFetches() {
        return fetches;
    }

    @Override
    public String getName() {
        return "fake";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public TrendsSession buildRequest(String entity, String timeframe, String geo) {
        if (!available) {
            throw new UpstreamUnavailableException("fake client disabled");
        }
        sessions.add(entity + "|" + timeframe + "|" + geo);
        if (buildFailure != null) {
            throw buildFailure;
        }
        return kind -> {
            fetches.add(kind);
            Deque<Object> queue = responses.get(kind);
            Object next = queue != null ? queue.poll() : null;
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return next != null ? (UpstreamPayload) next : UpstreamPayload.empty();
        };
    }
}
