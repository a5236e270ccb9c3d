package com.trendradar.radar.model;

import java.util.List;

/**
 * Aggregated records of one run before report-mode selection.
 */
public record PipelineOutput(
    List<AggregatedRecord> records,
    int finalRound,
    int totalRawItems,
    int platformsQueried,
    int platformsSucceeded
) {}
