package com.episcope.trends.upstream;

import com.episcope.trends.config.TrendsProperties;
import com.episcope.trends.exception.RateLimitedException;
import com.episcope.trends.exception.TrendsException;
import com.episcope.trends.exception.UpstreamRequestException;
import com.episcope.trends.exception.UpstreamTimeoutException;
import com.episcope.trends.exception.UpstreamUnavailableException;
import com.episcope.trends.model.MetricKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Google Trends client speaking the explore / widgetdata JSON API.
 *
 * A session performs one explore call, which yields a token per widget, and then one
 * widgetdata call per metric kind.
 */
@Slf4j
@Component
public class GoogleTrendsClient implements TrendsClient {

    private static final String NAME = "google-trends";
    private static final String SESSION_COOKIE = "NID";

    private final WebClient webClient;
    private final TrendsProperties.UpstreamConfig config;
    private final GoogleTrendsResponseParser parser;
    private final ObjectMapper objectMapper;

    public GoogleTrendsClient(
            WebClient webClient,
            TrendsProperties properties,
            GoogleTrendsResponseParser parser,
            ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.config = properties.getUpstream();
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled();
    }

    @Override
    public TrendsSession buildRequest(String entity, String timeframe, String geo) {
        if (!isAvailable()) {
            throw new UpstreamUnavailableException("Google Trends client is disabled");
        }

        String safeGeo = geo != null ? geo : "";
        log.info("Opening Google Trends session: entity={}, timeframe={}, geo={}", entity, timeframe, safeGeo);

        String cookie = fetchSessionCookie(safeGeo);
        String body = get("/explore?hl={hl}&tz={tz}&req={req}", cookie,
                config.getLanguage(), config.getTzOffset(), exploreRequest(entity, timeframe, safeGeo));

        return new GoogleTrendsSession(entity, safeGeo, cookie, parser.parseExplore(body));
    }

    private String exploreRequest(String entity, String timeframe, String geo) {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode items = request.putArray("comparisonItem");
        items.addObject()
                .put("keyword", entity)
                .put("time", timeframe)
                .put("geo", geo);
        request.put("category", 0);
        request.put("property", "");
        return write(request);
    }

    /**
     * Visit the home page once to pick up the session cookie. Requests still go out
     * without it, so failures here are only logged.
     */
    private String fetchSessionCookie(String geo) {
        try {
            return webClient.get()
                    .uri(config.getCookieUrl() + "?geo={geo}", geo)
                    .exchangeToMono(response -> {
                        ResponseCookie cookie = response.cookies().getFirst(SESSION_COOKIE);
                        return response.releaseBody()
                                .then(Mono.justOrEmpty(cookie))
                                .map(c -> c.getName() + "=" + c.getValue());
                    })
                    .block(config.getTimeout());
        } catch (RuntimeException e) {
            log.warn("Could not obtain Google Trends session cookie: {}", e.getMessage());
            return null;
        }
    }

    private String get(String path, String cookie, Object... uriVariables) {
        try {
            WebClient.RequestHeadersSpec<?> spec = webClient.get().uri(config.getBaseUrl() + path, uriVariables);
            if (cookie != null) {
                spec = spec.header(HttpHeaders.COOKIE, cookie);
            }
            return spec.retrieve()
                    .bodyToMono(String.class)
                    .block(config.getTimeout());
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new RateLimitedException("Rate limited by Google Trends (HTTP 429)",
                        parseRetryAfter(e.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)), e);
            }
            throw new UpstreamRequestException("Google Trends returned HTTP " + e.getStatusCode().value(), e);
        } catch (TrendsException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new UpstreamTimeoutException("Google Trends request timed out after " + config.getTimeout(), e);
            }
            throw new UpstreamRequestException("Google Trends request failed: " + e.getMessage(), e);
        }
    }

    private static boolean isTimeout(RuntimeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        // Mono.block(Duration) signals an elapsed timeout with a bare IllegalStateException
        return e instanceof IllegalStateException
                && e.getMessage() != null
                && e.getMessage().startsWith("Timeout on blocking read");
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UpstreamRequestException("Failed to serialize Google Trends request", e);
        }
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by this upstream
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return null;
        }
    }

    private final class GoogleTrendsSession implements TrendsSession {

        private final String entity;
        private final String geo;
        private final String cookie;
        private final Map<String, ExploreWidget> widgets;

        private GoogleTrendsSession(String entity, String geo, String cookie, Map<String, ExploreWidget> widgets) {
            this.entity = entity;
            this.geo = geo;
            this.cookie = cookie;
            this.widgets = widgets;
        }

        @Override
        public UpstreamPayload fetch(MetricKind kind) {
            switch (kind) {
                case INTEREST_OVER_TIME:
                    return fetchWidget(kind, GoogleTrendsResponseParser.TIMESERIES_WIDGET, "multiline",
                            body -> parser.parseInterestOverTime(body, entity));
                case INTEREST_BY_REGION:
                    return fetchWidget(kind, GoogleTrendsResponseParser.GEO_MAP_WIDGET, "comparedgeo",
                            body -> parser.parseInterestByRegion(body, entity));
                case RELATED_QUERIES:
                    return fetchWidget(kind, GoogleTrendsResponseParser.RELATED_QUERIES_WIDGET, "relatedsearches",
                            body -> parser.parseRelated(body, entity, kind));
                case RELATED_TOPICS:
                    return fetchWidget(kind, GoogleTrendsResponseParser.RELATED_TOPICS_WIDGET, "relatedsearches",
                            body -> parser.parseRelated(body, entity, kind));
                default:
                    throw new IllegalArgumentException("Unsupported metric kind: " + kind);
            }
        }

        private UpstreamPayload fetchWidget(
                MetricKind kind,
                String widgetId,
                String endpoint,
                Function<String, UpstreamPayload> parse) {
            ExploreWidget widget = widgets.get(widgetId);
            if (widget == null) {
                log.debug("No {} widget for entity={}, geo={}; returning empty payload", widgetId, entity, geo);
                return UpstreamPayload.empty();
            }

            JsonNode request = widget.getRequest();
            if (kind == MetricKind.INTEREST_BY_REGION && request.isObject()) {
                ObjectNode copy = ((ObjectNode) request).deepCopy();
                copy.put("resolution", geo.isEmpty() ? "COUNTRY" : "REGION");
                copy.put("includeLowSearchVolumeGeos", false);
                request = copy;
            }

            log.info("Fetching {} from Google Trends: entity={}, geo={}", kind, entity, geo);
            String body = get("/widgetdata/" + endpoint + "?hl={hl}&tz={tz}&req={req}&token={token}", cookie,
                    config.getLanguage(), config.getTzOffset(), write(request), widget.getToken());
            return parse.apply(body);
        }
    }
}
