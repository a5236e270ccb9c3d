package com.trendradar.radar.model;

public record ExecutionOutcome(
    String status,
    String artifactPath,
    int matchedCount,
    long durationMs,
    String errorMessage
) {
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    public static ExecutionOutcome success(String artifactPath, int matchedCount, long durationMs) {
        return new ExecutionOutcome(SUCCESS, artifactPath, matchedCount, durationMs, null);
    }

    public static ExecutionOutcome failed(String errorMessage, long durationMs) {
        return new ExecutionOutcome(FAILED, null, 0, durationMs, errorMessage);
    }
}
