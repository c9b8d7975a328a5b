package com.episcope.trends.model.payload;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    RISING,
    FALLING,
    STABLE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
