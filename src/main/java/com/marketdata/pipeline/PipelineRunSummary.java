package com.marketdata.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one pipeline run.
 */
public record PipelineRunSummary(
    Instant startedAt,
    Instant finishedAt,
    List<String> symbolsRequested,
    List<String> symbolsWithData,
    int recordCount,
    boolean success
) {}
