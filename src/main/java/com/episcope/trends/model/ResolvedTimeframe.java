package com.episcope.trends.model;

import lombok.Builder;
import lombok.Value;

/**
 * A timeframe token after validation, with conversion details when the
 * requested token was not accepted as-is.
 */
@Value
@Builder
public class ResolvedTimeframe {
    String token;
    String requested;
    boolean converted;
    String reason;
    String description;

    public String getConversionNote() {
        if (!converted) {
            return null;
        }
        return "'" + requested + "' was converted to '" + token + "' for better data quality"
                + (reason != null ? ". " + reason : "");
    }
}
