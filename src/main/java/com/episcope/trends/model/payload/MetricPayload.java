package com.episcope.trends.model.payload;

/**
 * Canonical normalized record for one metric kind.
 */
public interface MetricPayload {

    /**
     * Annotation set when the upstream body could not be fully normalized, otherwise null.
     */
    String getError();
}
