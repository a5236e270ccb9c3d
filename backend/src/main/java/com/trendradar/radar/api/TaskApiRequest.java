package com.trendradar.radar.api;

import com.trendradar.radar.model.KeywordGroup;

import java.util.List;

public record TaskApiRequest(
    String name,
    String userId,
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    String reportMode,
    String schedule,
    Boolean expandKeywords,
    String status,
    String description
) {
}
