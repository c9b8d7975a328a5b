package com.episcope.trends.upstream;

import com.episcope.trends.model.MetricKind;

/**
 * Request context returned by {@link TrendsClient#buildRequest}.
 */
public interface TrendsSession {

    /**
     * Fetch one metric kind.
     *
     * @throws com.episcope.trends.exception.RateLimitedException              when the upstream throttles
     * @throws com.episcope.trends.exception.UpstreamRequestException          on transport or status failures
     * @throws com.episcope.trends.exception.UpstreamMalformedResponseException when the body cannot be parsed
     */
    UpstreamPayload fetch(MetricKind kind);
}
