package com.trendradar.radar.api;

import com.trendradar.radar.model.KeywordGroup;

import java.util.List;

public record SearchApiRequest(
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    String reportMode,
    Boolean expandKeywords,
    Boolean generateReport,
    String userId
) {
}
