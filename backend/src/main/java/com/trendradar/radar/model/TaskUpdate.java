package com.trendradar.radar.model;

import java.util.List;

/**
 * Partial task update; null fields are left unchanged.
 */
public record TaskUpdate(
    String name,
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    ReportMode reportMode,
    String schedule,
    Boolean expandKeywords,
    TaskStatus status,
    String description
) {
    public boolean isEmpty() {
        return name == null
            && keywords == null
            && filters == null
            && platforms == null
            && reportMode == null
            && schedule == null
            && expandKeywords == null
            && status == null
            && description == null;
    }
}
