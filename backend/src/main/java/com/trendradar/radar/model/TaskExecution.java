package com.trendradar.radar.model;

import java.time.Instant;

public record TaskExecution(
    long id,
    String taskId,
    String artifactPath,
    int matchedCount,
    long durationMs,
    String status,
    String errorMessage,
    Instant executedAt
) {}
