package com.trendradar.radar.model;

import java.util.List;

public record ReducedReport(List<AggregatedRecord> records, boolean degraded) {}
