package com.trendradar.radar.model;

public record RecordIdentity(String platform, String titleKey) {}
