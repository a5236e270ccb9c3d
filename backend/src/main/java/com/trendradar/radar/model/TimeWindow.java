package com.trendradar.radar.model;

import java.time.Instant;

/**
 * Window of one fetch round. {@code round} is 1-based within a run.
 */
public record TimeWindow(int round, Instant startedAt, Instant endedAt) {}
