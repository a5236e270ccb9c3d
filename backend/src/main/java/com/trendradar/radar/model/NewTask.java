package com.trendradar.radar.model;

import java.util.List;

public record NewTask(
    String name,
    String userId,
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    ReportMode reportMode,
    String schedule,
    Boolean expandKeywords,
    String description
) {}
