package com.trendradar.radar.model;

import java.util.List;

public record RunResult(
    List<AggregatedRecord> records,
    RunStats stats,
    long durationMs,
    ReportMode reportMode,
    String signature,
    boolean degraded
) {}
