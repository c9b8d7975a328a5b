package com.episcope.trends.upstream;

/**
 * Upstream source of search interest data.
 * Implementations handle the source's session setup and wire format.
 */
public interface TrendsClient {

    /**
     * Get client name (e.g., "google-trends").
     *
     * @return client name
     */
    String getName();

    /**
     * Check if the client is enabled and able to reach the upstream.
     *
     * @return true if ready to use
     */
    boolean isAvailable();

    /**
     * Open a request context for one entity, timeframe and geo. All metric kinds
     * of a batch are fetched through the same session.
     *
     * @param entity    search term
     * @param timeframe upstream timeframe token
     * @param geo       geo code, empty for worldwide
     * @return session for fetching individual metric kinds
     * @throws com.episcope.trends.exception.UpstreamUnavailableException when the client is disabled
     * @throws com.episcope.trends.exception.RateLimitedException         when the upstream throttles
     * @throws com.episcope.trends.exception.UpstreamRequestException     on any other upstream failure
     */
    TrendsSession buildRequest(String entity, String timeframe, String geo);
}
