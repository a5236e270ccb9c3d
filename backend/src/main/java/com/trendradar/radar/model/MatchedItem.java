package com.trendradar.radar.model;

public record MatchedItem(RawItem item, String keyword) {}
