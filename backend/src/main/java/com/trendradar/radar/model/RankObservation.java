package com.trendradar.radar.model;

public record RankObservation(int rank, TimeWindow window) {}
