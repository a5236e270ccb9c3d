package com.trendradar.radar.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trendradar.radar.model.ReportMode;
import com.trendradar.radar.model.RunResult;
import com.trendradar.radar.model.RunStats;
import com.trendradar.radar.model.SearchOutcome;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(
    boolean success,
    ReportMode reportMode,
    String signature,
    boolean degraded,
    long durationMs,
    RunStats stats,
    String artifactPath,
    List<ReportLink> links,
    String taskId,
    Long executionId
) {
    public static SearchResponse from(SearchOutcome outcome, String taskId) {
        RunResult result = outcome.result();
        List<ReportLink> links = outcome.artifactPath() == null
            ? result.records().stream().map(ReportLink::from).toList()
            : null;
        return new SearchResponse(
            true,
            result.reportMode(),
            result.signature(),
            result.degraded(),
            result.durationMs(),
            result.stats(),
            outcome.artifactPath(),
            links,
            taskId,
            outcome.executionId()
        );
    }
}
