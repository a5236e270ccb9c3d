package com.trendradar.radar.model;

import java.time.Instant;

public record RawItem(
    String title,
    String url,
    String mobileUrl,
    String platformId,
    int rank,
    Instant fetchedAt
) {}
