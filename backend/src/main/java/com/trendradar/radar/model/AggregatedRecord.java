package com.trendradar.radar.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record AggregatedRecord(
    RecordIdentity identity,
    String title,
    String url,
    String mobileUrl,
    String platform,
    String keyword,
    List<RankObservation> observations,
    TimeWindow firstSeen,
    TimeWindow lastSeen
) {
    @JsonIgnore
    public RankObservation latestObservation() {
        return observations.isEmpty() ? null : observations.get(observations.size() - 1);
    }

    public List<Integer> ranks() {
        return observations.stream().map(RankObservation::rank).toList();
    }
}
