package com.trendradar.radar.model;

public record SearchOutcome(RunResult result, String artifactPath, Long executionId) {}
