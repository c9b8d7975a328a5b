package com.episcope.trends.service;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.exception.InvalidMetricKindException;
import com.episcope.trends.exception.RateLimitedException;
import com.episcope.trends.exception.UnsupportedEntityException;
import com.episcope.trends.exception.UpstreamMalformedResponseException;
import com.episcope.trends.exception.UpstreamTimeoutException;
import com.episcope.trends.exception.UpstreamUnavailableException;
import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.model.EntryStatus;
import com.episcope.trends.model.FetchErrorKind;
import com.episcope.trends.model.FetchOptions;
import com.episcope.trends.model.MetricKind;
import com.episcope.trends.model.MetricResult;
import com.episcope.trends.model.RequestLogEntry;
import com.episcope.trends.model.RequestStatus;
import com.episcope.trends.model.ResolvedTimeframe;
import com.episcope.trends.model.ResponseCacheStatus;
import com.episcope.trends.model.TrendsResponse;
import com.episcope.trends.model.payload.MetricPayload;
import com.episcope.trends.service.cache.CacheKeyGenerator;
import com.episcope.trends.service.cache.CacheStore;
import com.episcope.trends.service.cache.FreshnessPolicy;
import com.episcope.trends.service.log.RequestLog;
import com.episcope.trends.service.processing.DataProcessor;
import com.episcope.trends.service.ratelimit.RateLimiter;
import com.episcope.trends.service.timeframe.FallbackSelector;
import com.episcope.trends.service.timeframe.TimeframeNormalizer;
import com.episcope.trends.upstream.TrendsClient;
import com.episcope.trends.upstream.TrendsSession;
import com.episcope.trends.upstream.UpstreamPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Serves metric batches from cache or upstream.
 *
 * Flow per batch:
 * 1. Validate entity, metric kinds and timeframe (input errors are thrown)
 * 2. Read every kind's cache entry and decide which kinds need a live fetch
 * 3. Take the global upstream slot once, open one upstream session, fetch the
 *    kinds sequentially with a short pause in between
 * 4. Degrade failed kinds to their cached payload, or to an error marker
 * 5. Optionally retry empty related/regional kinds with a denser timeframe
 */
@Slf4j
@Service
public class FetchOrchestrator {

    private final CacheStore cacheStore;
    private final RequestLog requestLog;
    private final RateLimiter rateLimiter;
    private final TrendsClient trendsClient;
    private final DataProcessor dataProcessor;
    private final TimeframeNormalizer timeframeNormalizer;
    private final FallbackSelector fallbackSelector;
    private final FreshnessPolicy freshnessPolicy;
    private final TrendsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FetchOrchestrator(
            CacheStore cacheStore,
            RequestLog requestLog,
            RateLimiter rateLimiter,
            TrendsClient trendsClient,
            DataProcessor dataProcessor,
            TimeframeNormalizer timeframeNormalizer,
            FallbackSelector fallbackSelector,
            FreshnessPolicy freshnessPolicy,
            TrendsProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.requestLog = requestLog;
        this.rateLimiter = rateLimiter;
        this.trendsClient = trendsClient;
        this.dataProcessor = dataProcessor;
        this.timeframeNormalizer = timeframeNormalizer;
        this.fallbackSelector = fallbackSelector;
        this.freshnessPolicy = freshnessPolicy;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TrendsResponse getMetrics(String entity, Collection<MetricKind> kinds, String timeframe, String geo) {
        return getMetrics(entity, kinds, timeframe, geo, FetchOptions.DEFAULTS);
    }

    /**
     * Fetch a batch of metric kinds for one entity, timeframe and geo.
     *
     * @param entity    tracked entity, matched case-insensitively
     * @param kinds     metric kinds to return, at least one
     * @param timeframe timeframe token; invalid tokens are converted
     * @param geo       geo code, empty for worldwide, null for the configured default
     * @param options   fallback, force-refresh and timeout switches
     * @return one slot per requested kind; upstream failures never escape
     * @throws UnsupportedEntityException  when the entity is not tracked
     * @throws InvalidMetricKindException  when no kind is requested
     * @throws com.episcope.trends.exception.InvalidTimeframeException when the timeframe is blank
     */
    public TrendsResponse getMetrics(
            String entity,
            Collection<MetricKind> kinds,
            String timeframe,
            String geo,
            FetchOptions options) {
        String canonicalEntity = resolveEntity(entity);
        List<MetricKind> requested = validateKinds(kinds);
        ResolvedTimeframe resolved = timeframeNormalizer.resolve(timeframe);
        String safeGeo = geo != null ? geo.trim() : properties.getDefaultGeo();
        FetchOptions opts = options != null ? options : FetchOptions.DEFAULTS;
        Instant deadline = opts.getTimeout() != null ? clock.instant().plus(opts.getTimeout()) : null;

        Map<MetricKind, MetricResult> results =
                fetchBatch(canonicalEntity, requested, resolved.getToken(), safeGeo, opts.isForceRefresh(), deadline);

        Map<MetricKind, String> fallbackUsed = null;
        if (opts.isFallbackEnabled()) {
            fallbackUsed = applyFallbacks(canonicalEntity, requested, resolved.getToken(), safeGeo, opts, deadline, results);
        }

        return buildResponse(canonicalEntity, resolved, safeGeo, results, fallbackUsed);
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    String resolveEntity(String entity) {
        if (entity != null) {
            for (String supported : properties.getEntities()) {
                if (supported.equalsIgnoreCase(entity.trim())) {
                    return supported;
                }
            }
        }
        throw new UnsupportedEntityException("Unsupported entity: " + entity
                + ". Supported: " + String.join(", ", properties.getEntities()));
    }

    private static List<MetricKind> validateKinds(Collection<MetricKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            throw new InvalidMetricKindException("At least one metric kind is required");
        }
        Set<MetricKind> distinct = new LinkedHashSet<>();
        for (MetricKind kind : kinds) {
            if (kind == null) {
                throw new InvalidMetricKindException("Metric kind must not be null");
            }
            distinct.add(kind);
        }
        return new ArrayList<>(distinct);
    }

    // ------------------------------------------------------------------
    // Batch
    // ------------------------------------------------------------------

    private Map<MetricKind, MetricResult> fetchBatch(
            String entity,
            List<MetricKind> kinds,
            String timeframe,
            String geo,
            boolean forceRefresh,
            Instant deadline) {
        Instant now = clock.instant();
        Batch batch = new Batch(entity, timeframe, geo, deadline);
        List<MetricKind> toFetch = new ArrayList<>();

        for (MetricKind kind : kinds) {
            String key = CacheKeyGenerator.generate(entity, kind, timeframe, geo);
            batch.keys.put(kind, key);

            CacheEntry entry = cacheStore.get(key).filter(CacheEntry::hasPayload).orElse(null);
            if (entry != null) {
                cacheStore.touchAccess(key, now);
                batch.entries.put(kind, entry);
            }

            if (needsFetch(entry, now, forceRefresh)) {
                toFetch.add(kind);
            } else {
                log.debug("Cache HIT: entity={}, kind={}, timeframe={}, geo={}", entity, kind, timeframe, geo);
                batch.results.put(kind, served(entry, now));
            }
        }

        if (!toFetch.isEmpty()) {
            log.info("Live fetch needed: entity={}, kinds={}, timeframe={}, geo={}", entity, toFetch, timeframe, geo);
            fetchLive(batch, toFetch);
        }

        Map<MetricKind, MetricResult> ordered = new LinkedHashMap<>();
        kinds.forEach(kind -> ordered.put(kind, batch.results.get(kind)));
        return ordered;
    }

    /**
     * Whether a kind goes to upstream in this batch.
     */
    boolean needsFetch(CacheEntry entry, Instant now, boolean forceRefresh) {
        if (entry == null || forceRefresh) {
            return true;
        }

        EntryStatus status = cacheStore.deriveStatus(entry, now);
        if (status == EntryStatus.FRESH) {
            return false;
        }
        if (entry.getRetryCount() >= properties.getRateLimit().getMaxRetries()) {
            log.debug("Retry ceiling reached for key={} ({} failures), serving cache", entry.getKey(), entry.getRetryCount());
            return false;
        }
        if (inCooldown(entry, now)) {
            log.debug("Rate-limit cool-down active for key={} until {}", entry.getKey(),
                    entry.getLastFailedAt().plus(properties.getRateLimit().getCooldown()));
            return false;
        }
        return true;
    }

    private boolean inCooldown(CacheEntry entry, Instant now) {
        return entry.getLastErrorKind() == FetchErrorKind.RATE_LIMITED
                && entry.getLastFailedAt() != null
                && now.isBefore(entry.getLastFailedAt().plus(properties.getRateLimit().getCooldown()));
    }

    private void fetchLive(Batch batch, List<MetricKind> toFetch) {
        if (!trendsClient.isAvailable()) {
            log.warn("Upstream {} unavailable, serving cache for {}", trendsClient.getName(), batch.entity);
            degradeUnattempted(batch, toFetch, "Upstream service unavailable");
            return;
        }

        try (RateLimiter.Slot slot = rateLimiter.waitForSlot(remaining(batch.deadline))) {
            TrendsSession session = openSession(batch, toFetch);
            if (session == null) {
                return;
            }

            boolean first = true;
            for (MetricKind kind : toFetch) {
                if (!first) {
                    rateLimiter.pauseBetweenKinds();
                }
                first = false;
                if (isExpired(batch.deadline)) {
                    log.warn("Call deadline reached, skipping remaining kinds for {}", batch.entity);
                    break;
                }
                batch.results.put(kind, fetchOne(batch, session, kind));
            }
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for the upstream slot: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching {} from upstream", batch.entity);
        }

        degradeUnattempted(batch, toFetch, "Request timed out before upstream data was fetched");
    }

    /**
     * Open the upstream session; on failure every pending kind is degraded and null is returned.
     */
    private TrendsSession openSession(Batch batch, List<MetricKind> toFetch) throws InterruptedException {
        Instant started = clock.instant();
        try {
            return trendsClient.buildRequest(batch.entity, timeframeNormalizer.toUpstreamToken(batch.timeframe), batch.geo);
        } catch (UpstreamUnavailableException e) {
            log.warn("Upstream unavailable for {}: {}", batch.entity, e.getMessage());
            degradeUnattempted(batch, toFetch, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            FetchErrorKind errorKind = classify(e);
            log.warn("Failed to open upstream session for {} ({}): {}", batch.entity, errorKind, e.getMessage());

            int attempt = 0;
            for (MetricKind kind : toFetch) {
                CacheEntry entry = batch.entries.get(kind);
                attempt = Math.max(attempt, entry != null ? entry.getRetryCount() : 0);
                recordFailure(batch, kind, errorMessage(e), errorKind, started);
                batch.results.put(kind, degraded(batch, kind, errorMessage(e)));
            }
            if (errorKind == FetchErrorKind.RATE_LIMITED) {
                rateLimiter.backoff(attempt);
            }
            return null;
        }
    }

    private MetricResult fetchOne(Batch batch, TrendsSession session, MetricKind kind) throws InterruptedException {
        String key = batch.keys.get(kind);
        Instant started = clock.instant();
        try {
            MetricPayload processed;
            String note = null;
            try {
                UpstreamPayload raw = session.fetch(kind);
                processed = dataProcessor.process(kind, raw, batch.entity, batch.geo);
            } catch (UpstreamMalformedResponseException e) {
                log.warn("Malformed {} payload for {}: {}", kind, batch.entity, e.getMessage());
                note = e.getMessage();
                processed = dataProcessor.emptyRecord(kind, "Malformed upstream response: " + e.getMessage());
            }

            JsonNode payload = objectMapper.valueToTree(processed);
            Instant fetchedAt = clock.instant();
            Instant expiresAt = freshnessPolicy.expiryFor(fetchedAt);
            cacheStore.update(key, current -> current != null
                    ? current.withSuccess(payload, fetchedAt, expiresAt)
                    : newEntry(batch, kind, key, payload, fetchedAt, expiresAt));

            recordAttempt(batch, kind, RequestStatus.SUCCESS, started, note);
            log.info("Fetched {} for {} in {}ms", kind, batch.entity, Duration.between(started, fetchedAt).toMillis());
            return MetricResult.fresh(payload, fetchedAt, batch.timeframe);

        } catch (RateLimitedException e) {
            log.warn("Rate limited fetching {} for {}: {}", kind, batch.entity, e.getMessage());
            CacheEntry entry = batch.entries.get(kind);
            recordFailure(batch, kind, errorMessage(e), FetchErrorKind.RATE_LIMITED, started);
            rateLimiter.backoff(entry != null ? entry.getRetryCount() : 0);
            return degraded(batch, kind, errorMessage(e));

        } catch (RuntimeException e) {
            FetchErrorKind errorKind = classify(e);
            log.warn("Failed to fetch {} for {} ({}): {}", kind, batch.entity, errorKind, e.getMessage());
            recordFailure(batch, kind, errorMessage(e), errorKind, started);
            return degraded(batch, kind, errorMessage(e));
        }
    }

    private CacheEntry newEntry(Batch batch, MetricKind kind, String key, JsonNode payload,
                                Instant fetchedAt, Instant expiresAt) {
        return CacheEntry.builder()
                .key(key)
                .entity(batch.entity)
                .metricKind(kind)
                .timeframe(batch.timeframe)
                .geo(batch.geo)
                .lastAccessedAt(fetchedAt)
                .build()
                .withSuccess(payload, fetchedAt, expiresAt);
    }

    /**
     * Count a failure against an existing entry. Keys without an entry stay absent.
     */
    private void recordFailure(Batch batch, MetricKind kind, String message, FetchErrorKind errorKind, Instant started) {
        Instant now = clock.instant();
        cacheStore.update(batch.keys.get(kind), current -> current != null
                ? current.withFailure(message, errorKind, now)
                : null);
        RequestStatus status = errorKind == FetchErrorKind.RATE_LIMITED ? RequestStatus.RATE_LIMITED : RequestStatus.ERROR;
        recordAttempt(batch, kind, status, started, message);
    }

    private void recordAttempt(Batch batch, MetricKind kind, RequestStatus status, Instant started, String error) {
        Instant now = clock.instant();
        requestLog.record(RequestLogEntry.builder()
                .timestamp(now)
                .entity(batch.entity)
                .metricKind(kind)
                .timeframe(batch.timeframe)
                .geo(batch.geo)
                .status(status)
                .responseTime(Duration.between(started, now))
                .errorMessage(error)
                .cacheHit(false)
                .build());
    }

    /**
     * Cached payload when one exists, otherwise an error marker.
     */
    private MetricResult degraded(Batch batch, MetricKind kind, String error) {
        CacheEntry entry = batch.entries.get(kind);
        if (entry != null) {
            log.warn("Serving cached {} for {} after upstream failure", kind, batch.entity);
            return MetricResult.cached(entry, ResponseCacheStatus.STALE_CACHED);
        }
        return MetricResult.error(error, ResponseCacheStatus.ERROR, batch.timeframe);
    }

    /**
     * Kinds that never reached upstream fall back to cache, or report no cache.
     */
    private void degradeUnattempted(Batch batch, List<MetricKind> toFetch, String reason) {
        Instant now = clock.instant();
        for (MetricKind kind : toFetch) {
            if (batch.results.containsKey(kind)) {
                continue;
            }
            CacheEntry entry = batch.entries.get(kind);
            batch.results.put(kind, entry != null
                    ? served(entry, now)
                    : MetricResult.error(MetricResult.NO_CACHE_MESSAGE + ": " + reason, ResponseCacheStatus.NO_CACHE, batch.timeframe));
        }
    }

    private MetricResult served(CacheEntry entry, Instant now) {
        if (entry == null) {
            return MetricResult.error(MetricResult.NO_CACHE_MESSAGE, ResponseCacheStatus.NO_CACHE, null);
        }
        EntryStatus status = cacheStore.deriveStatus(entry, now);
        return MetricResult.cached(entry, status == EntryStatus.FRESH
                ? ResponseCacheStatus.FRESH
                : ResponseCacheStatus.STALE_CACHED);
    }

    // ------------------------------------------------------------------
    // Fallback
    // ------------------------------------------------------------------

    private Map<MetricKind, String> applyFallbacks(
            String entity,
            List<MetricKind> requested,
            String timeframe,
            String geo,
            FetchOptions options,
            Instant deadline,
            Map<MetricKind, MetricResult> results) {
        Map<MetricKind, String> fallbackUsed = new LinkedHashMap<>();
        for (MetricKind kind : requested) {
            fallbackUsed.put(kind, null);
            if (!kind.supportsFallback() || results.get(kind).hasContent(kind)) {
                continue;
            }

            String alternate = fallbackSelector.alternateTimeframe(kind);
            if (alternate.equals(timeframe)) {
                continue;
            }
            if (isExpired(deadline)) {
                log.warn("Call deadline reached, skipping fallback for {} of {}", kind, entity);
                continue;
            }

            log.info("Trying fallback timeframe {} for {} of {}", alternate, kind, entity);
            MetricResult alternateResult = fetchBatch(entity, List.of(kind), alternate, geo,
                    options.isForceRefresh(), deadline).get(kind);
            if (alternateResult.hasContent(kind)) {
                results.put(kind, alternateResult);
                fallbackUsed.put(kind, alternate);
            } else {
                log.info("Fallback timeframe {} returned no data for {} of {}", alternate, kind, entity);
            }
        }
        return fallbackUsed;
    }

    // ------------------------------------------------------------------
    // Response
    // ------------------------------------------------------------------

    private TrendsResponse buildResponse(
            String entity,
            ResolvedTimeframe resolved,
            String geo,
            Map<MetricKind, MetricResult> results,
            Map<MetricKind, String> fallbackUsed) {
        ResponseCacheStatus overall = null;
        Instant lastUpdated = null;
        for (MetricResult result : results.values()) {
            overall = overall == null ? result.getCacheStatus() : overall.worst(result.getCacheStatus());
            if (result.getLastUpdated() != null && (lastUpdated == null || result.getLastUpdated().isAfter(lastUpdated))) {
                lastUpdated = result.getLastUpdated();
            }
        }

        TrendsResponse.TrendsResponseBuilder response = TrendsResponse.builder()
                .entity(entity)
                .timeframe(resolved.getToken())
                .timeframeDescription(resolved.getDescription())
                .geo(geo)
                .metrics(results)
                .cacheStatus(overall)
                .lastUpdated(lastUpdated)
                .fallbackUsed(fallbackUsed);

        if (resolved.isConverted()) {
            response.originalTimeframe(resolved.getRequested())
                    .timeframeConverted(true)
                    .conversionNote(resolved.getConversionNote());
        }
        return response.build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static FetchErrorKind classify(RuntimeException e) {
        if (e instanceof RateLimitedException) {
            return FetchErrorKind.RATE_LIMITED;
        }
        if (e instanceof UpstreamTimeoutException) {
            return FetchErrorKind.TIMEOUT;
        }
        if (e instanceof UpstreamUnavailableException) {
            return FetchErrorKind.UPSTREAM_UNAVAILABLE;
        }
        return FetchErrorKind.UPSTREAM_ERROR;
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private Duration remaining(Instant deadline) {
        if (deadline == null) {
            return null;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private boolean isExpired(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Per-batch working state.
     */
    private static final class Batch {
        private final String entity;
        private final String timeframe;
        private final String geo;
        private final Instant deadline;
        private final Map<MetricKind, String> keys = new EnumMap<>(MetricKind.class);
        private final Map<MetricKind, CacheEntry> entries = new EnumMap<>(MetricKind.class);
        private final Map<MetricKind, MetricResult> results = new EnumMap<>(MetricKind.class);

        private Batch(String entity, String timeframe, String geo, Instant deadline) {
            this.entity = entity;
            this.timeframe = timeframe;
            this.geo = geo;
            this.deadline = deadline;
        }
    }
}
