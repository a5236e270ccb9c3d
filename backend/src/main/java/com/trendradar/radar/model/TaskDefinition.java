package com.trendradar.radar.model;

import java.time.Instant;
import java.util.List;

public record TaskDefinition(
    String id,
    String name,
    String userId,
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    ReportMode reportMode,
    String schedule,
    boolean expandKeywords,
    TaskStatus status,
    String description,
    Instant createdAt,
    Instant updatedAt
) {}
