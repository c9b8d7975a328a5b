package com.episcope.trends.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one upstream call attempt.
 */
public enum RequestStatus {

    SUCCESS("success"),
    RATE_LIMITED("rate_limited"),
    ERROR("error");

    private final String wireName;

    RequestStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
