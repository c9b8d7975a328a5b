package com.episcope.trends.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a cache clear request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClearCacheResult {

    private boolean success;

    private String message;

    @JsonProperty("deleted_count")
    private int deletedCount;

    /**
     * Set when the clear failed.
     */
    private String error;
}
