package com.trendradar.radar.model;

import java.util.List;

public record MatchedBatch(TimeWindow window, List<MatchedItem> items) {}
