package com.trendradar.radar.model;

import java.util.List;

public record RunRequest(
    List<KeywordGroup> keywords,
    List<String> filters,
    List<String> platforms,
    String reportMode,
    Boolean expandKeywords
) {
    public static RunRequest fromTask(TaskDefinition task) {
        return new RunRequest(
            task.keywords(),
            task.filters(),
            task.platforms(),
            task.reportMode() == null ? null : task.reportMode().code(),
            task.expandKeywords()
        );
    }
}
