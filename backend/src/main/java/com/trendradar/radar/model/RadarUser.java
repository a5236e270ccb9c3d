package com.trendradar.radar.model;

import java.time.Instant;

public record RadarUser(String id, String username, String email, Instant createdAt, Instant updatedAt) {}
