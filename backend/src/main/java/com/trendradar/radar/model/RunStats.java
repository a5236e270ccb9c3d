package com.trendradar.radar.model;

public record RunStats(
    int totalRawItems,
    int matchedGroups,
    int matchedRecords,
    int platformsQueried,
    int platformsSucceeded
) {}
