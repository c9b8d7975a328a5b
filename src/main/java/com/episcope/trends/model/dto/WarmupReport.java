package com.episcope.trends.model.dto;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts from one cache warm-up run, one unit per (entity, timeframe) batch.
 */
@Data
public class WarmupReport {
    private int batches;
    private int fresh;
    private int staleCached;
    private int failed;
    private List<String> errors = new ArrayList<>();
    private Duration duration;
}
